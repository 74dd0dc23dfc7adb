package com.m4brew.management.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.m4brew.management.jobs.JobMode;
import com.m4brew.management.jobs.JobParameters;
import com.m4brew.management.jobs.JobStatus;
import java.time.Instant;

/** Immutable record of one completed run. */
public record HistoryEntry(
    @JsonProperty("ts") Instant timestamp,
    @JsonProperty("job_id") String jobId,
    @JsonProperty("mode") JobMode mode,
    @JsonProperty("dry_run") boolean dryRun,
    @JsonProperty("status") JobStatus status,
    @JsonProperty("settings") JobParameters parameters,
    @JsonProperty("exit_code") Integer exitCode,
    @JsonProperty("runtime_s") Integer runtimeSeconds,
    @JsonProperty("summary") ObjectNode summary,
    @JsonProperty("output") String output) {}

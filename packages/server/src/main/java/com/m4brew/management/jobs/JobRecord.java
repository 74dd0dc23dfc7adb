package com.m4brew.management.jobs;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;

/**
 * Persisted description of the in-flight or most recently finished job.
 *
 * <p>Instances are plain mutable documents. The orchestrator hands out copies; the background
 * execution owns the instance it writes progress into.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class JobRecord {
  /** Name of the timestamp refreshed on every write; excluded from write fingerprints. */
  public static final String FRESHNESS_FIELD = "updated";

  @JsonProperty("id")
  public String id;

  @JsonProperty("status")
  public JobStatus status;

  @JsonProperty("cancel_requested")
  public boolean cancelRequested;

  @JsonProperty("started")
  public Instant started;

  @JsonProperty(FRESHNESS_FIELD)
  public Instant updated;

  @JsonProperty("mode")
  public JobMode mode;

  @JsonProperty("dry_run")
  public boolean dryRun;

  @JsonProperty("settings")
  public JobParameters parameters;

  @JsonProperty("current")
  public int current;

  @JsonProperty("total")
  public int total;

  @JsonProperty("current_book")
  public String currentLabel;

  @JsonProperty("current_path")
  public String currentPath;

  /** Process group id of the attached task, present only while a process is attached. */
  @JsonProperty("pid")
  public Long pid;

  @JsonProperty("exit_code")
  public Integer exitCode;

  @JsonProperty("runtime_s")
  public Integer runtimeSeconds;

  @JsonProperty("summary")
  public ObjectNode summary;

  public JobRecord copy() {
    JobRecord c = new JobRecord();
    c.id = id;
    c.status = status;
    c.cancelRequested = cancelRequested;
    c.started = started;
    c.updated = updated;
    c.mode = mode;
    c.dryRun = dryRun;
    c.parameters = parameters;
    c.current = current;
    c.total = total;
    c.currentLabel = currentLabel;
    c.currentPath = currentPath;
    c.pid = pid;
    c.exitCode = exitCode;
    c.runtimeSeconds = runtimeSeconds;
    c.summary = summary == null ? null : summary.deepCopy();
    return c;
  }

  public boolean isActive() {
    return status != null && status.isActive();
  }

  @Override
  public String toString() {
    return "JobRecord{id=%s, status=%s, mode=%s, dryRun=%s, current=%d/%d, pid=%s, exitCode=%s}"
        .formatted(id, status, mode, dryRun, current, total, pid, exitCode);
  }
}

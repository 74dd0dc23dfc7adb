package com.m4brew.management.jobs;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mode parameters handed to the task. Opaque to the orchestrator apart from the root folder, which
 * must be present.
 */
public record JobParameters(
    @JsonProperty("root_folder") String rootFolder,
    @JsonProperty("audio_mode") String audioMode,
    @JsonProperty("bitrate") Integer bitrate) {}

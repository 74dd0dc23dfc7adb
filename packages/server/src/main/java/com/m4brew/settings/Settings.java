package com.m4brew.settings;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.m4brew.management.jobs.JobMode;
import com.m4brew.management.jobs.JobParameters;

/** Operator settings persisted between runs. */
public record Settings(
    @JsonProperty("root_folder") String rootFolder,
    @JsonProperty("audio_mode") String audioMode,
    @JsonProperty("bitrate") Integer bitrate,
    @JsonProperty("last_mode") JobMode lastMode,
    @JsonProperty("last_dry_run") Boolean lastDryRun) {

  public JobParameters toParameters() {
    return new JobParameters(rootFolder, audioMode, bitrate);
  }

  public Settings withLastRun(JobMode mode, boolean dryRun) {
    return new Settings(rootFolder, audioMode, bitrate, mode, dryRun);
  }
}

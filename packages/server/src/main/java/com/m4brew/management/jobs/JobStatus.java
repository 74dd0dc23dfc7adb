package com.m4brew.management.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle state of the controller's single job. */
public enum JobStatus {
  /** Task process is attached and producing output. */
  RUNNING,
  /** Cancellation was requested; termination is in progress. */
  CANCELING,
  /** Task exited with code 0. */
  FINISHED,
  /** Task exited with a non-zero code, or the controller failed to drive it. */
  FAILED,
  /** Task was terminated on operator request. */
  CANCELED;

  public boolean isActive() {
    return this == RUNNING || this == CANCELING;
  }

  public boolean isTerminal() {
    return !isActive();
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static JobStatus fromWireName(String value) {
    return value == null ? null : JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

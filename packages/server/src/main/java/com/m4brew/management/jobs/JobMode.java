package com.m4brew.management.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** What the external task is asked to do with the library. */
public enum JobMode {
  /** Build an .m4b per book folder and move the sources into {@code _backup_files}. */
  CONVERT,
  /** Rename each book's single .m4b to {@code "<Book> - <Author>.m4b"}. */
  CORRECT,
  /** Delete {@code _backup_files} folders. */
  CLEANUP;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static JobMode fromWireName(String value) {
    return value == null ? null : JobMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }

  /** Lenient parse for request input: unknown or missing values fall back to {@link #CONVERT}. */
  public static JobMode parseOrDefault(String value) {
    if (value == null || value.isBlank()) return CONVERT;
    try {
      return fromWireName(value);
    } catch (IllegalArgumentException e) {
      return CONVERT;
    }
  }
}

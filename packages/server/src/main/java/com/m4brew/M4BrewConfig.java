package com.m4brew;

import com.m4brew.exception.ConfigException;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolved controller configuration. Built once at startup from {@code application.yaml} and
 * passed to the components that need it.
 */
public final class M4BrewConfig {
  private final Path dataDir;
  private final String taskShell;
  private final String taskScript;
  private final boolean processGroup;
  private final Duration interruptWait;
  private final Duration terminateWait;
  private final Duration exitWait;
  private final boolean dockerEnabled;
  private final String dockerBinary;
  private final String dockerLabel;
  private final int historyMaxEntries;
  private final String defaultRootFolder;
  private final String defaultAudioMode;
  private final int defaultBitrate;
  private final String httpHostname;
  private final int httpPort;

  private M4BrewConfig(Configuration c) {
    this.dataDir = Path.of(requireText(c, "data.dir", "/config"));
    this.taskShell = requireText(c, "task.shell", "/bin/bash");
    this.taskScript = requireText(c, "task.script", "/scripts/m4brew.sh");
    this.processGroup = c.getBoolean("task.process-group", true);
    this.interruptWait = millis(c, "task.termination.interrupt-wait-ms", 1500);
    this.terminateWait = millis(c, "task.termination.terminate-wait-ms", 1500);
    this.exitWait = millis(c, "task.termination.exit-wait-ms", 5000);
    this.dockerEnabled = c.getBoolean("task.subresources.docker.enabled", true);
    this.dockerBinary = requireText(c, "task.subresources.docker.binary", "docker");
    this.dockerLabel = requireText(c, "task.subresources.docker.label", "m4brew.job");
    this.historyMaxEntries = positive(c, "history.max-entries", 100);
    this.defaultRootFolder = c.getString("settings.defaults.root-folder", "");
    this.defaultAudioMode = requireText(c, "settings.defaults.audio-mode", "match");
    this.defaultBitrate = positive(c, "settings.defaults.bitrate", 64);
    this.httpHostname = requireText(c, "http.hostname", "0.0.0.0").trim();
    this.httpPort = c.getInt("http.port", 8080);
  }

  public static M4BrewConfig from(Configuration configuration) {
    try {
      return new M4BrewConfig(configuration);
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
    }
  }

  private static String requireText(Configuration c, String key, String defaultValue) {
    String value = c.getString(key, defaultValue);
    if (StringUtils.isBlank(value)) {
      throw new ConfigException("Missing " + key + " configuration");
    }
    return value;
  }

  private static int positive(Configuration c, String key, int defaultValue) {
    int value = c.getInt(key, defaultValue);
    if (value < 1) {
      throw new ConfigException("%s must be positive, got %d".formatted(key, value));
    }
    return value;
  }

  private static Duration millis(Configuration c, String key, long defaultValue) {
    long value = c.getLong(key, defaultValue);
    if (value < 0) {
      throw new ConfigException("%s must not be negative, got %d".formatted(key, value));
    }
    return Duration.ofMillis(value);
  }

  public Path dataDir() {
    return dataDir;
  }

  public Path jobFile() {
    return dataDir.resolve("job.json");
  }

  public Path settingsFile() {
    return dataDir.resolve("settings.json");
  }

  public Path historyFile() {
    return dataDir.resolve("history.jsonl");
  }

  public Path outputFile() {
    return dataDir.resolve("job_output.log");
  }

  public String taskShell() {
    return taskShell;
  }

  public String taskScript() {
    return taskScript;
  }

  public boolean processGroup() {
    return processGroup;
  }

  public Duration interruptWait() {
    return interruptWait;
  }

  public Duration terminateWait() {
    return terminateWait;
  }

  public Duration exitWait() {
    return exitWait;
  }

  public boolean dockerEnabled() {
    return dockerEnabled;
  }

  public String dockerBinary() {
    return dockerBinary;
  }

  public String dockerLabel() {
    return dockerLabel;
  }

  public int historyMaxEntries() {
    return historyMaxEntries;
  }

  public String defaultRootFolder() {
    return defaultRootFolder;
  }

  public String defaultAudioMode() {
    return defaultAudioMode;
  }

  public int defaultBitrate() {
    return defaultBitrate;
  }

  public String httpHostname() {
    return httpHostname;
  }

  public int httpPort() {
    return httpPort;
  }
}

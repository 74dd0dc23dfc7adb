package com.m4brew;

import static org.junit.jupiter.api.Assertions.*;

import com.m4brew.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

class M4BrewConfigTest {

  @TempDir Path temp;

  @Test
  void bundledConfigurationProvidesDefaults() {
    M4BrewConfig config = M4BrewConfig.from(new ConfigurationProvider(null).config());

    assertEquals(Path.of("/config/job.json"), config.jobFile());
    assertEquals(Path.of("/config/history.jsonl"), config.historyFile());
    assertEquals("/bin/bash", config.taskShell());
    assertTrue(config.processGroup());
    assertEquals(Duration.ofMillis(1500), config.interruptWait());
    assertEquals(100, config.historyMaxEntries());
    assertEquals("match", config.defaultAudioMode());
    assertEquals(64, config.defaultBitrate());
    assertEquals(8080, config.httpPort());
  }

  @Test
  void externalFileAndCommandLineOverridesApply() throws Exception {
    Path file = temp.resolve("application.yaml");
    Files.writeString(
        file,
        String.join(
            "\n",
            "data:",
            "  dir: " + temp,
            "task:",
            "  subresources:",
            "    docker:",
            "      enabled: false",
            ""));
    StartupParameters params =
        new StartupParameters(new String[] {"--config=" + file, "--http.port=9191"});

    M4BrewConfig config =
        M4BrewConfig.from(
            new ConfigurationProvider(params.configFile(), params.overrides()).config());

    assertEquals(temp.resolve("settings.json"), config.settingsFile());
    assertFalse(config.dockerEnabled());
    assertEquals(9191, config.httpPort());
  }

  @Test
  void invalidValuesAreRejected() {
    YAMLConfiguration yaml = new YAMLConfiguration();
    yaml.setProperty("history.max-entries", 0);
    assertThrows(ConfigException.class, () -> M4BrewConfig.from(yaml));

    YAMLConfiguration negative = new YAMLConfiguration();
    negative.setProperty("task.termination.exit-wait-ms", -1);
    assertThrows(ConfigException.class, () -> M4BrewConfig.from(negative));

    YAMLConfiguration garbage = new YAMLConfiguration();
    garbage.setProperty("http.port", "eighty");
    assertThrows(ConfigException.class, () -> M4BrewConfig.from(garbage));
  }

  @Test
  void missingConfigFileFailsFast() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(temp.resolve("nope.yaml").toString(), Map.of()));
  }

  @Test
  void startupParametersParseFlagsAndTypes() {
    StartupParameters p = new StartupParameters(new String[] {"--verbose", "--http.port=81"});
    assertEquals(Boolean.TRUE, p.getParameter("verbose", Boolean.class));
    assertEquals(81, p.getParameter("http.port", Integer.class));
    assertNull(p.configFile());
    assertThrows(ConfigException.class, () -> new StartupParameters(new String[] {"stray"}));
  }
}

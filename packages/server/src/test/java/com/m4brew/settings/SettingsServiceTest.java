package com.m4brew.settings;

import static org.junit.jupiter.api.Assertions.*;

import com.m4brew.management.jobs.JobMode;
import java.nio.file.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

class SettingsServiceTest {

  @TempDir Path temp;

  private SettingsService service() {
    return new SettingsService(
        temp.resolve("settings.json"), new Settings("/audiobooks", "match", 64, null, null));
  }

  @Test
  void firstLoadWritesDefaults() {
    Settings s = service().load();

    assertEquals("/audiobooks", s.rootFolder());
    assertEquals(64, s.bitrate());
    assertTrue(Files.exists(temp.resolve("settings.json")));
  }

  @Test
  void corruptFileFallsBackToDefaults() throws Exception {
    Files.writeString(temp.resolve("settings.json"), "not json");
    assertEquals("match", service().load().audioMode());
  }

  @Test
  void updateKeepsValidValuesAndRejectsInvalidOnes() {
    SettingsService svc = service();
    Settings s = svc.update(new Settings("/books", "stereo", 128, JobMode.CORRECT, true));
    assertEquals("/books", s.rootFolder());
    assertEquals("stereo", s.audioMode());
    assertEquals(128, s.bitrate());
    assertEquals(JobMode.CORRECT, s.lastMode());

    s = svc.update(new Settings("relative/path", "surround", 100, null, null));
    assertEquals("/books", s.rootFolder());
    assertEquals("stereo", s.audioMode());
    assertEquals(128, s.bitrate());
    assertEquals(JobMode.CORRECT, s.lastMode());
    assertTrue(s.lastDryRun());
  }

  @Test
  void updatesPersistAcrossInstances() {
    service().update(new Settings(null, "mono", 32, null, null));

    Settings s = service().load();
    assertEquals("mono", s.audioMode());
    assertEquals(32, s.bitrate());
    assertEquals("/audiobooks", s.rootFolder());
  }

  @Test
  void updateWithOnlyLastRunFieldsKeepsEverythingElse() {
    SettingsService svc = service();
    Settings s = svc.update(new Settings(null, null, null, JobMode.CLEANUP, true));

    assertEquals(JobMode.CLEANUP, s.lastMode());
    assertTrue(s.lastDryRun());
    assertEquals("/audiobooks", s.rootFolder());
    assertEquals("match", s.audioMode());
    assertEquals(64, s.bitrate());
    assertEquals(JobMode.CLEANUP, service().load().lastMode());
  }

  @Test
  void nullValuesAreNotAllowed() {
    assertFalse(SettingsService.isAllowedAudioMode(null));
    assertFalse(SettingsService.isAllowedBitrate(null));
    assertTrue(SettingsService.isAllowedAudioMode("mono"));
    assertTrue(SettingsService.isAllowedBitrate(192));
  }
}

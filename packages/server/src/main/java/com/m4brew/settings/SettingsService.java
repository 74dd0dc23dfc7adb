package com.m4brew.settings;

import com.m4brew.M4BrewConfig;
import com.m4brew.logging.LoggingService;
import com.m4brew.store.JsonFileStore;
import com.m4brew.utility.JacksonUtility;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Loads and saves {@link Settings}. Missing or unreadable settings fall back to the configured
 * defaults; updates keep the previous value of any field outside its allowed set.
 */
public final class SettingsService {
  private static final Logger log = LoggingService.getLogger(SettingsService.class);

  public static final List<String> AUDIO_MODES = List.of("match", "mono", "stereo");
  public static final List<Integer> BITRATES = List.of(32, 64, 96, 128, 160, 192);

  private final JsonFileStore<Settings> store;
  private final Settings defaults;

  public SettingsService(Path file, Settings defaults) {
    this.store = new JsonFileStore<>(file, Settings.class, JacksonUtility.getJsonMapper());
    this.defaults = defaults;
  }

  public static SettingsService create(M4BrewConfig config) {
    return new SettingsService(
        config.settingsFile(),
        new Settings(
            config.defaultRootFolder(),
            config.defaultAudioMode(),
            config.defaultBitrate(),
            null,
            null));
  }

  public synchronized Settings load() {
    Optional<Settings> stored = store.load();
    if (stored.isEmpty()) {
      log.info("No usable settings at {}, writing defaults", store.file());
      store.save(defaults);
      return defaults;
    }
    return fillMissing(stored.get());
  }

  /** Merge {@code requested} over the current settings, validating each field, and persist. */
  public synchronized Settings update(Settings requested) {
    Settings current = load();
    Settings next =
        new Settings(
            acceptRoot(requested.rootFolder(), current.rootFolder()),
            isAllowedAudioMode(requested.audioMode()) ? requested.audioMode() : current.audioMode(),
            isAllowedBitrate(requested.bitrate()) ? requested.bitrate() : current.bitrate(),
            requested.lastMode() != null ? requested.lastMode() : current.lastMode(),
            requested.lastDryRun() != null ? requested.lastDryRun() : current.lastDryRun());
    store.save(next);
    return next;
  }

  /** Null-safe membership check; {@code List.of} rejects {@code contains(null)}. */
  public static boolean isAllowedAudioMode(String audioMode) {
    return audioMode != null && AUDIO_MODES.contains(audioMode);
  }

  public static boolean isAllowedBitrate(Integer bitrate) {
    return bitrate != null && BITRATES.contains(bitrate);
  }

  private Settings fillMissing(Settings s) {
    return new Settings(
        Objects.requireNonNullElse(s.rootFolder(), defaults.rootFolder()),
        Objects.requireNonNullElse(s.audioMode(), defaults.audioMode()),
        Objects.requireNonNullElse(s.bitrate(), defaults.bitrate()),
        s.lastMode(),
        s.lastDryRun());
  }

  private static String acceptRoot(String requested, String current) {
    if (requested == null) return current;
    String trimmed = requested.strip();
    return !trimmed.isEmpty() && trimmed.startsWith("/") ? trimmed : current;
  }
}

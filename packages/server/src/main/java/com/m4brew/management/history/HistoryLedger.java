package com.m4brew.management.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.m4brew.exception.IoException;
import com.m4brew.logging.LoggingService;
import com.m4brew.utility.IoUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;

/**
 * Append-only, capped log of completed runs stored as one JSON object per line, oldest first.
 *
 * <p>Appends rewrite the whole file; the cap keeps it small and appends happen once per job.
 * Malformed lines are skipped on read so a partially corrupted file still yields every intact
 * entry.
 */
public final class HistoryLedger {
  private static final Logger log = LoggingService.getLogger(HistoryLedger.class);

  private final Path file;
  private final int maxEntries;
  private final ObjectMapper mapper;

  public HistoryLedger(Path file, int maxEntries, ObjectMapper mapper) {
    if (maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
    }
    this.file = file;
    this.maxEntries = maxEntries;
    this.mapper = mapper;
  }

  public synchronized void append(HistoryEntry entry) {
    List<HistoryEntry> entries = new ArrayList<>(readAll());
    entries.add(entry);
    if (entries.size() > maxEntries) {
      entries = entries.subList(entries.size() - maxEntries, entries.size());
    }

    StringBuilder sb = new StringBuilder();
    try {
      for (HistoryEntry e : entries) {
        sb.append(mapper.writeValueAsString(e)).append('\n');
      }
      IoUtil.writeAtomically(file, sb.toString().getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new IoException("Failed to write history " + file, e);
    }
    log.debug("History now holds {} entries (cap {})", entries.size(), maxEntries);
  }

  /** @return all readable entries, oldest first */
  public synchronized List<HistoryEntry> readAll() {
    if (!Files.isRegularFile(file)) {
      return List.of();
    }
    List<String> lines;
    try {
      lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.warn("Could not read history {}: {}", file, e.getMessage());
      return List.of();
    }

    List<HistoryEntry> out = new ArrayList<>(lines.size());
    int lineNo = 0;
    for (String line : lines) {
      lineNo++;
      if (line.isBlank()) continue;
      try {
        HistoryEntry entry = mapper.readValue(line, HistoryEntry.class);
        if (entry != null) out.add(entry);
      } catch (IOException e) {
        log.debug("Skipping malformed history line {}: {}", lineNo, e.getMessage());
      }
    }
    return Collections.unmodifiableList(out);
  }

  /** @return up to {@code limit} entries, newest first */
  public List<HistoryEntry> recent(int limit) {
    List<HistoryEntry> all = new ArrayList<>(readAll());
    Collections.reverse(all);
    if (limit >= 0 && all.size() > limit) {
      return List.copyOf(all.subList(0, limit));
    }
    return List.copyOf(all);
  }

  public synchronized void clear() {
    IoUtil.silentDelete(file);
  }
}

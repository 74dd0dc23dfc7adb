package com.m4brew.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.m4brew.exception.IoException;
import com.m4brew.logging.LoggingService;
import com.m4brew.utility.HashUtil;
import com.m4brew.utility.IoUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * A single JSON document persisted in one file.
 *
 * <p>Writes go through {@link IoUtil#writeAtomically(Path, byte[])}, so readers never observe a
 * partially written document. Each save is fingerprinted; a save whose content equals the last
 * written one is skipped. The optional freshness field (a timestamp refreshed on every write) is
 * left out of the fingerprint so that touching it alone does not cause I/O.
 *
 * <p>Corrupt or unreadable files load as empty.
 *
 * @param <T> document type, mapped with Jackson
 */
public final class JsonFileStore<T> {
  private static final Logger log = LoggingService.getLogger(JsonFileStore.class);

  private final Path file;
  private final Class<T> type;
  private final ObjectMapper mapper;
  private final String freshnessField;

  private String lastFingerprint;

  public JsonFileStore(Path file, Class<T> type, ObjectMapper mapper, String freshnessField) {
    this.file = file;
    this.type = type;
    this.mapper = mapper;
    this.freshnessField = freshnessField;
  }

  public JsonFileStore(Path file, Class<T> type, ObjectMapper mapper) {
    this(file, type, mapper, null);
  }

  public Path file() {
    return file;
  }

  public synchronized Optional<T> load() {
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      T value = mapper.readValue(Files.readAllBytes(file), type);
      return Optional.ofNullable(value);
    } catch (Exception e) {
      log.warn("Ignoring unreadable document {}: {}", file, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Persist {@code document} unless it matches the last written content.
   *
   * @return {@code true} when the file was written, {@code false} when the write was skipped
   */
  public synchronized boolean save(T document) {
    try {
      JsonNode tree = mapper.valueToTree(document);
      String fingerprint = fingerprint(tree);
      if (lastFingerprint == null) {
        lastFingerprint = fingerprintOnDisk();
      }
      if (fingerprint.equals(lastFingerprint)) {
        log.trace("Skipping unchanged write of {}", file);
        return false;
      }
      IoUtil.writeAtomically(file, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(tree));
      lastFingerprint = fingerprint;
      return true;
    } catch (IOException e) {
      throw new IoException("Failed to write " + file, e);
    }
  }

  public synchronized void delete() {
    IoUtil.silentDelete(file);
    lastFingerprint = null;
  }

  private String fingerprint(JsonNode tree) throws IOException {
    JsonNode relevant = tree;
    if (freshnessField != null && tree instanceof ObjectNode node && node.has(freshnessField)) {
      ObjectNode copy = node.deepCopy();
      copy.remove(freshnessField);
      relevant = copy;
    }
    return HashUtil.sha256Hex(mapper.writeValueAsBytes(relevant));
  }

  private String fingerprintOnDisk() {
    if (!Files.isRegularFile(file)) return "";
    try {
      return fingerprint(mapper.readTree(Files.readAllBytes(file)));
    } catch (Exception e) {
      return "";
    }
  }
}

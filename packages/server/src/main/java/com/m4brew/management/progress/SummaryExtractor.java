package com.m4brew.management.progress;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.m4brew.logging.LoggingService;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Finds the task's machine-readable run summary in its captured output.
 *
 * <p>The task prints {@value #MARKER} followed by a JSON object, possibly several times; the last
 * occurrence is authoritative. Some task versions escaped the quotes of that payload, so a failed
 * parse is retried once with {@code \"} turned into {@code "}.
 */
public final class SummaryExtractor {
  private static final Logger log = LoggingService.getLogger(SummaryExtractor.class);

  public static final String MARKER = "__M4B_SUMMARY_JSON__";

  private final ObjectMapper mapper;

  public SummaryExtractor(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public Optional<ObjectNode> extract(String output) {
    if (output == null || output.isEmpty()) return Optional.empty();

    String payload = null;
    for (String line : output.split("\\R")) {
      int at = line.indexOf(MARKER);
      if (at >= 0) {
        payload = line.substring(at + MARKER.length()).strip();
      }
    }
    if (payload == null || payload.isEmpty()) return Optional.empty();

    Optional<ObjectNode> parsed = parseObject(payload);
    if (parsed.isEmpty()) {
      // TODO: drop once every deployed task version prints unescaped JSON
      parsed = parseObject(payload.replace("\\\"", "\""));
    }
    if (parsed.isEmpty()) {
      log.debug("Summary payload could not be parsed: {}", payload);
    }
    return parsed;
  }

  private Optional<ObjectNode> parseObject(String text) {
    try {
      JsonNode node = mapper.readTree(text);
      return node instanceof ObjectNode obj ? Optional.of(obj) : Optional.empty();
    } catch (Exception e) {
      return Optional.empty();
    }
  }
}

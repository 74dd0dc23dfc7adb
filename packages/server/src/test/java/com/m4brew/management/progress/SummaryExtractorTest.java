package com.m4brew.management.progress;

import static org.junit.jupiter.api.Assertions.*;

import com.m4brew.utility.JacksonUtility;
import org.junit.jupiter.api.*;

class SummaryExtractorTest {

  private final SummaryExtractor extractor = new SummaryExtractor(JacksonUtility.getJsonMapper());

  @Test
  void lastMarkerLineWins() {
    String out =
        String.join(
            "\n",
            "[10:00:00] __M4B_SUMMARY_JSON__ {\"converted\":1}",
            "noise",
            "[10:00:05] __M4B_SUMMARY_JSON__ {\"converted\":2,\"success\":true}",
            "done");

    var summary = extractor.extract(out).orElseThrow();
    assertEquals(2, summary.get("converted").asInt());
    assertTrue(summary.get("success").asBoolean());
  }

  @Test
  void escapedPayloadIsParsedOnSecondAttempt() {
    var summary =
        extractor.extract("__M4B_SUMMARY_JSON__ {\\\"mode\\\":\\\"convert\\\"}").orElseThrow();
    assertEquals("convert", summary.get("mode").asText());
  }

  @Test
  void absentOrInvalidSummaryIsEmpty() {
    assertTrue(extractor.extract("no summary here").isEmpty());
    assertTrue(extractor.extract("__M4B_SUMMARY_JSON__ {broken").isEmpty());
    assertTrue(extractor.extract("__M4B_SUMMARY_JSON__ [1,2]").isEmpty());
    assertTrue(extractor.extract(null).isEmpty());
  }
}

package io.windowstats.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DurationParserTest {

  @Test
  @DisplayName("Should parse every supported unit")
  void shouldParseSupportedUnits() {
    assertEquals(Duration.ofMillis(500), DurationParser.parse("500ms"));
    assertEquals(Duration.ofSeconds(30), DurationParser.parse("30s"));
    assertEquals(Duration.ofMinutes(5), DurationParser.parse("5m"));
    assertEquals(Duration.ofHours(1), DurationParser.parse(" 1 h "));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "30", "s", "-5s", "1.5s", "10d", "ten seconds"})
  @DisplayName("Should reject malformed durations")
  void shouldRejectMalformedDurations(String text) {
    assertThrows(IllegalArgumentException.class, () -> DurationParser.parse(text));
  }

  @ParameterizedTest
  @ValueSource(strings = {"999999999999h", "9223372036854775807m", "99999999999999999999s"})
  @DisplayName("Should reject durations too long to measure in nanoseconds")
  void shouldRejectOversizedDurations(String text) {
    assertThrows(IllegalArgumentException.class, () -> DurationParser.parse(text));
  }

  @Test
  @DisplayName("Should accept the longest measurable duration")
  void shouldAcceptMaximumDuration() {
    assertEquals(Duration.ofHours(2_000_000), DurationParser.parse("2000000h"));
    assertTrue(DurationParser.parse("2000000h").compareTo(DurationParser.MAX) < 0);
  }

  @Test
  @DisplayName("Should reject null")
  void shouldRejectNull() {
    assertThrows(IllegalArgumentException.class, () -> DurationParser.parse(null));
  }
}

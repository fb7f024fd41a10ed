package io.windowstats.util;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses short durations such as {@code 500ms}, {@code 30s}, {@code 5m} or {@code 1h}. */
public final class DurationParser {

  private static final Pattern PATTERN = Pattern.compile("^\\s*(\\d+)\\s*(ms|s|m|h)\\s*$");

  /** Longest duration representable in nanoseconds, about 292 years. */
  public static final Duration MAX = Duration.ofNanos(Long.MAX_VALUE);

  private DurationParser() {}

  public static Duration parse(String text) {
    Preconditions.checkArgument(text != null, "duration is required");
    Matcher matcher = PATTERN.matcher(text);
    Preconditions.checkArgument(matcher.matches(), "Invalid duration: '%s'", text);

    Duration duration;
    try {
      long amount = Long.parseLong(matcher.group(1));
      duration =
          switch (matcher.group(2)) {
            case "ms" -> Duration.ofMillis(amount);
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            default -> throw new IllegalArgumentException("Invalid duration unit: " + text);
          };
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Duration too large: '" + text + "'", e);
    }
    Preconditions.checkArgument(
        duration.compareTo(MAX) <= 0, "Duration too large: '%s' (max %s)", text, MAX);
    return duration;
  }
}

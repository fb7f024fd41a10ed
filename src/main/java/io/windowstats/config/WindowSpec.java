package io.windowstats.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.windowstats.util.DurationParser;
import java.time.Duration;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How a configured stat closes windows. {@code INTERVAL} needs {@code duration}, {@code
 * FIXED_COUNT} needs {@code count}, {@code HYBRID} needs both and closes on whichever comes first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WindowSpec {
  private WindowType type;
  private String duration;
  private Long count;

  public enum WindowType {
    INTERVAL,
    FIXED_COUNT,
    HYBRID
  }

  @JsonIgnore
  public Duration getWindowDuration() {
    return DurationParser.parse(duration);
  }

  void validate(String statName) {
    if (type == null) {
      throw new IllegalArgumentException("Stat '" + statName + "' has no window type");
    }
    if (type != WindowType.FIXED_COUNT) {
      if (duration == null) {
        throw new IllegalArgumentException(
            "Stat '" + statName + "' needs a duration for a " + type + " window");
      }
      if (getWindowDuration().isZero()) {
        throw new IllegalArgumentException("Stat '" + statName + "' has a zero window duration");
      }
    }
    if (type != WindowType.INTERVAL && (count == null || count <= 0)) {
      throw new IllegalArgumentException(
          "Stat '" + statName + "' needs a positive count for a " + type + " window");
    }
  }
}

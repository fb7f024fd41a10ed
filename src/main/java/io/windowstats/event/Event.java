package io.windowstats.event;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** A structured event, e.g. the summary of one closed stat window. */
@Data
@Builder
public class Event {
  private final String type;
  private final String message;
  private final Instant timestamp;
  private final Map<String, Number> metadata;
}

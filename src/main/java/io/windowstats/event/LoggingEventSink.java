package io.windowstats.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.windowstats.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes each event as a JSON line to an SLF4J logger at INFO. */
public class LoggingEventSink implements EventSink {

  public static final String DEFAULT_LOGGER = "io.windowstats.events";

  private final Logger eventLog;

  public LoggingEventSink() {
    this(DEFAULT_LOGGER);
  }

  public LoggingEventSink(String loggerName) {
    this.eventLog = LoggerFactory.getLogger(loggerName);
  }

  @Override
  public void emit(Event event) {
    if (!eventLog.isInfoEnabled()) {
      return;
    }
    try {
      eventLog.info(JsonUtil.write(event));
    } catch (JsonProcessingException e) {
      eventLog.warn(
          "Could not serialize {} event '{}': {}",
          event.getType(),
          event.getMessage(),
          e.getMessage());
    }
  }
}

package io.windowstats.event;

import com.google.common.base.Preconditions;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans every event out to the registered handlers. A handler that throws is logged and skipped;
 * the remaining handlers still receive the event.
 */
public class EventHandlers implements EventSink {
  private static final Logger log = LoggerFactory.getLogger(EventHandlers.class);

  private final CopyOnWriteArrayList<EventSink> handlers = new CopyOnWriteArrayList<>();

  /** Returns false if the handler was already registered. */
  public boolean register(EventSink handler) {
    Preconditions.checkNotNull(handler, "handler");
    return handlers.addIfAbsent(handler);
  }

  public boolean unregister(EventSink handler) {
    return handlers.remove(handler);
  }

  public int size() {
    return handlers.size();
  }

  @Override
  public void emit(Event event) {
    for (EventSink handler : handlers) {
      try {
        handler.emit(event);
      } catch (RuntimeException e) {
        log.warn(
            "Event handler {} failed for {} event '{}'",
            handler,
            event.getType(),
            event.getMessage(),
            e);
      }
    }
  }
}

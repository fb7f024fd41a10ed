package io.windowstats.event;

/**
 * Receives events produced by stats. Implementations should return quickly; stats call them from
 * the recording thread.
 */
@FunctionalInterface
public interface EventSink {

  void emit(Event event);
}

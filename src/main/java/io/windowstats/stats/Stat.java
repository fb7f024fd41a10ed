package io.windowstats.stats;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.windowstats.event.Event;
import io.windowstats.event.EventSink;
import io.windowstats.registry.StatRegistry;
import io.windowstats.stats.policy.WindowPolicy;
import java.time.Clock;
import java.util.Map;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Summarizes the values added to it over repeating windows. When a window closes its summary
 * becomes readable through {@link #get()} and is emitted as a {@value #EVENT_TYPE} event with one
 * metadata entry per aggregation, keyed {@code <name>.<aggregation>}. Empty windows replace the
 * previous summary but emit nothing.
 *
 * <p>A stat registers itself with its {@link StatRegistry} when constructed. {@link #close()}
 * emits any partially filled window and unregisters it, so stats are best used with
 * try-with-resources or owned by a {@code Monitor}.
 *
 * <p>All methods are thread-safe. The sink is always invoked outside the stat's lock.
 *
 * @param <T> numeric type of the values, see {@link NumericType}
 */
public final class Stat<T extends Number> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Stat.class);

  public static final String EVENT_TYPE = "windowstats.Stat";

  @Getter private final String name;
  @Getter private final AggregationSet aggregations;
  private final WindowPolicy policy;
  private final StatRegistry registry;
  private final EventSink sink;
  private final Clock clock;

  private final Object lock = new Object();
  private WindowAccumulator<T> current;
  private Map<Aggregation, T> previous = ImmutableMap.of();
  private boolean closed;

  public Stat(
      String name,
      NumericType<T> type,
      AggregationSet aggregations,
      WindowPolicy policy,
      StatRegistry registry,
      EventSink sink,
      Clock clock) {
    this.name = Preconditions.checkNotNull(name, "name");
    this.aggregations = Preconditions.checkNotNull(aggregations, "aggregations");
    this.policy = Preconditions.checkNotNull(policy, "policy");
    this.registry = Preconditions.checkNotNull(registry, "registry");
    this.sink = Preconditions.checkNotNull(sink, "sink");
    this.clock = Preconditions.checkNotNull(clock, "clock");
    this.current = new WindowAccumulator<>(Preconditions.checkNotNull(type, "type"), aggregations);

    // last: the registry must only ever see a fully constructed stat
    registry.register(this);
  }

  /** Adds {@code value} to the current window, closing windows as the policy dictates. */
  public void add(T value) {
    Preconditions.checkNotNull(value, "value");
    Event before;
    Event after;
    synchronized (lock) {
      Preconditions.checkState(!closed, "Stat %s is closed", name);
      before = maybeCloseLocked();
      current.fold(value);
      after = maybeCloseLocked();
    }
    try {
      emit(before);
    } finally {
      emit(after);
    }
  }

  /** Number of values in the current, still open window. */
  public long count() {
    synchronized (lock) {
      return current.count();
    }
  }

  /**
   * Summary of the last closed window, including a closed empty window (zeros, MEAN 0). Empty map
   * until the first window has closed.
   */
  public Map<Aggregation, T> get() {
    synchronized (lock) {
      return previous;
    }
  }

  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  /**
   * Emits the current window if it has any values and unregisters the stat, even when the sink
   * throws. Further calls to {@link #add} fail; repeated calls to {@code close} do nothing.
   */
  @Override
  public void close() {
    Event last;
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      last = current.count() > 0 ? closeWindowLocked() : null;
    }
    try {
      emit(last);
    } finally {
      registry.unregister(this);
    }
  }

  private Event maybeCloseLocked() {
    return policy.shouldClose(current) ? closeWindowLocked() : null;
  }

  private Event closeWindowLocked() {
    WindowAccumulator<T> finished = current;
    current = finished.reset();
    policy.afterClose();
    previous = finished.summarize();

    if (finished.count() == 0) {
      log.debug("Stat {} had an empty window", name);
      return null;
    }

    log.debug("Window closed for stat {}: {}", name, previous);
    return toEvent(previous);
  }

  private Event toEvent(Map<Aggregation, T> summary) {
    ImmutableMap.Builder<String, Number> metadata =
        ImmutableMap.builderWithExpectedSize(summary.size());
    summary.forEach((kind, v) -> metadata.put(name + "." + kind.displayName(), v));

    return Event.builder()
        .type(EVENT_TYPE)
        .message(name)
        .timestamp(clock.instant())
        .metadata(metadata.build())
        .build();
  }

  private void emit(Event event) {
    if (event != null) {
      sink.emit(event);
    }
  }

  @Override
  public String toString() {
    return "Stat{name=" + name + ", aggregations=" + aggregations + ", policy=" + policy + "}";
  }
}

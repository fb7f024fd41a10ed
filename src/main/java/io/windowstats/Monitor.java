package io.windowstats;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import io.windowstats.config.MonitorConfig;
import io.windowstats.config.StatSpec;
import io.windowstats.config.WindowSpec;
import io.windowstats.event.EventSink;
import io.windowstats.event.LoggingEventSink;
import io.windowstats.registry.InMemoryStatRegistry;
import io.windowstats.registry.StatRegistry;
import io.windowstats.stats.Aggregation;
import io.windowstats.stats.AggregationSet;
import io.windowstats.stats.NumericType;
import io.windowstats.stats.Stat;
import io.windowstats.stats.policy.AnyOfPolicy;
import io.windowstats.stats.policy.FixedCountPolicy;
import io.windowstats.stats.policy.IntervalPolicy;
import io.windowstats.stats.policy.WindowPolicy;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates stats bound to one registry, one event sink and one pair of clocks. Closing the monitor
 * closes every stat still registered, which emits their partially filled windows.
 *
 * <pre>{@code
 * try (Monitor monitor = Monitor.builder().sink(handlers).build()) {
 *   Stat<Double> latency =
 *       monitor.fixedCountStat("latency", NumericType.DOUBLE, 1000, Aggregation.MEAN);
 *   latency.add(12.5);
 * }
 * }</pre>
 */
@Getter
@Builder
public class Monitor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Monitor.class);

  @Builder.Default private final StatRegistry registry = new InMemoryStatRegistry();
  @Builder.Default private final EventSink sink = new LoggingEventSink();

  /** Monotonic time for interval windows. */
  @Builder.Default private final Ticker ticker = Ticker.systemTicker();

  /** Wall-clock time for event timestamps. */
  @Builder.Default private final Clock clock = Clock.systemUTC();

  public static Monitor create() {
    return builder().build();
  }

  public <T extends Number> Stat<T> intervalStat(
      String name, NumericType<T> type, Duration window, Aggregation... aggregations) {
    return stat(name, type, AggregationSet.of(aggregations), new IntervalPolicy(window, ticker));
  }

  public <T extends Number> Stat<T> fixedCountStat(
      String name, NumericType<T> type, long windowSize, Aggregation... aggregations) {
    return stat(name, type, AggregationSet.of(aggregations), new FixedCountPolicy(windowSize));
  }

  public <T extends Number> Stat<T> stat(
      String name, NumericType<T> type, AggregationSet aggregations, WindowPolicy policy) {
    return new Stat<>(name, type, aggregations, policy, registry, sink, clock);
  }

  /** Creates and registers every stat in {@code config}, in order. */
  public List<Stat<?>> createStats(MonitorConfig config) {
    config.validate();
    ImmutableList.Builder<Stat<?>> created = ImmutableList.builder();
    for (StatSpec spec : config.getStats()) {
      created.add(createStat(spec));
    }
    List<Stat<?>> stats = created.build();
    log.info("Created {} stats from configuration", stats.size());
    return stats;
  }

  private Stat<?> createStat(StatSpec spec) {
    WindowPolicy policy = policyFor(spec.getWindow());
    return switch (spec.getType()) {
      case LONG -> stat(spec.getName(), NumericType.LONG, spec.aggregationSet(), policy);
      case DOUBLE -> stat(spec.getName(), NumericType.DOUBLE, spec.aggregationSet(), policy);
    };
  }

  private WindowPolicy policyFor(WindowSpec window) {
    return switch (window.getType()) {
      case INTERVAL -> new IntervalPolicy(window.getWindowDuration(), ticker);
      case FIXED_COUNT -> new FixedCountPolicy(window.getCount());
      case HYBRID -> new AnyOfPolicy(
          new IntervalPolicy(window.getWindowDuration(), ticker),
          new FixedCountPolicy(window.getCount()));
    };
  }

  /**
   * Stats currently registered with this monitor's registry. A stat that is closing may still be
   * registered for a moment, so closed stats are left out.
   */
  public Collection<Stat<?>> liveStats() {
    return registry.stats().stream().filter(stat -> !stat.isClosed()).collect(toImmutableList());
  }

  @Override
  public void close() {
    Collection<Stat<?>> live = registry.stats();
    log.info("Closing monitor with {} live stats", live.size());
    for (Stat<?> stat : live) {
      try {
        stat.close();
      } catch (RuntimeException e) {
        log.warn("Failed to flush stat {} on close", stat.getName(), e);
      }
    }
  }
}

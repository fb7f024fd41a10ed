package io.windowstats.stats;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.EnumMap;
import java.util.Map;

/**
 * Running state of one window. Not thread-safe: {@link Stat} guards every access with its lock.
 *
 * @param <T> numeric type of the observations
 */
public final class WindowAccumulator<T extends Number> implements WindowState {

  private final NumericType<T> type;
  private final AggregationSet aggregations;

  private T value;
  private T sum;
  private T min;
  private T max;
  private long count;

  public WindowAccumulator(NumericType<T> type, AggregationSet aggregations) {
    this.type = type;
    this.aggregations = aggregations;
    this.value = type.zero();
    this.sum = type.zero();
    this.min = type.zero();
    this.max = type.zero();
  }

  public void fold(T observation) {
    if (aggregations.contains(Aggregation.VALUE)) {
      value = observation;
    }
    if (aggregations.contains(Aggregation.MEAN) || aggregations.contains(Aggregation.SUM)) {
      sum = type.add(sum, observation);
    }

    // count == 0 seeds the extrema with the first observation of the window
    if (aggregations.contains(Aggregation.MAX)) {
      if (count == 0 || type.compare(max, observation) < 0) {
        max = observation;
      }
    }
    if (aggregations.contains(Aggregation.MIN)) {
      if (count == 0 || type.compare(min, observation) > 0) {
        min = observation;
      }
    }

    count++;
  }

  /** One entry per selected aggregation, in declaration order of {@link Aggregation}. */
  public Map<Aggregation, T> summarize() {
    EnumMap<Aggregation, T> out = new EnumMap<>(Aggregation.class);

    if (aggregations.contains(Aggregation.VALUE)) {
      out.put(Aggregation.VALUE, value);
    }
    if (aggregations.contains(Aggregation.MEAN)) {
      out.put(Aggregation.MEAN, count == 0 ? type.zero() : type.mean(sum, count));
    }
    if (aggregations.contains(Aggregation.COUNT)) {
      out.put(Aggregation.COUNT, type.fromCount(count));
    }
    if (aggregations.contains(Aggregation.SUM)) {
      out.put(Aggregation.SUM, sum);
    }
    if (aggregations.contains(Aggregation.MAX)) {
      out.put(Aggregation.MAX, max);
    }
    if (aggregations.contains(Aggregation.MIN)) {
      out.put(Aggregation.MIN, min);
    }

    return out.isEmpty() ? ImmutableMap.of() : Maps.immutableEnumMap(out);
  }

  /** A fresh, empty accumulator for the next window. */
  public WindowAccumulator<T> reset() {
    return new WindowAccumulator<>(type, aggregations);
  }

  @Override
  public long count() {
    return count;
  }
}

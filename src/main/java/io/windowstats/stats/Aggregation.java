package io.windowstats.stats;

/** Summary kinds a {@link Stat} can compute over a window. */
public enum Aggregation {
  /** No aggregation. Never part of an {@link AggregationSet}. */
  NONE("none"),
  /** Most recently added value. */
  VALUE("value"),
  /** Mean of the values in the window, zero if there are none. */
  MEAN("mean"),
  /** Number of values added in the window. */
  COUNT("count"),
  /** Sum of the values in the window. */
  SUM("sum"),
  /** Maximum of the values in the window, zero if there are none. */
  MAX("max"),
  /** Minimum of the values in the window, zero if there are none. */
  MIN("min");

  private final String displayName;

  Aggregation(String displayName) {
    this.displayName = displayName;
  }

  /** Name used in event metadata keys, e.g. {@code latency.mean}. */
  public String displayName() {
    return displayName;
  }
}

package io.windowstats.stats;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

/**
 * Immutable selection of the aggregations a stat computes. Duplicates are collapsed and {@link
 * Aggregation#NONE} is dropped.
 */
public final class AggregationSet {

  private static final AggregationSet EMPTY = new AggregationSet(ImmutableSet.of());

  private final ImmutableSet<Aggregation> kinds;

  private AggregationSet(ImmutableSet<Aggregation> kinds) {
    this.kinds = kinds;
  }

  public static AggregationSet of(Aggregation... kinds) {
    return of(Arrays.asList(kinds));
  }

  public static AggregationSet of(Collection<Aggregation> kinds) {
    Preconditions.checkNotNull(kinds, "kinds");
    if (kinds.isEmpty()) {
      return EMPTY;
    }
    Set<Aggregation> selected = Sets.newEnumSet(kinds, Aggregation.class);
    selected.remove(Aggregation.NONE);
    return new AggregationSet(Sets.immutableEnumSet(selected));
  }

  public boolean contains(Aggregation kind) {
    return kinds.contains(kind);
  }

  /** Number of selected kinds, used as a capacity hint for summaries. */
  public int size() {
    return kinds.size();
  }

  public boolean isEmpty() {
    return kinds.isEmpty();
  }

  public Set<Aggregation> asSet() {
    return kinds;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof AggregationSet)) return false;
    return kinds.equals(((AggregationSet) o).kinds);
  }

  @Override
  public int hashCode() {
    return kinds.hashCode();
  }

  @Override
  public String toString() {
    return kinds.toString();
  }
}

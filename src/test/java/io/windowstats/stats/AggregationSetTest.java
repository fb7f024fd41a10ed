package io.windowstats.stats;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AggregationSetTest {

  @Test
  @DisplayName("Should collapse duplicates")
  void shouldCollapseDuplicates() {
    AggregationSet set =
        AggregationSet.of(Aggregation.SUM, Aggregation.MEAN, Aggregation.SUM, Aggregation.MEAN);

    assertEquals(2, set.size());
    assertTrue(set.contains(Aggregation.SUM));
    assertTrue(set.contains(Aggregation.MEAN));
    assertFalse(set.contains(Aggregation.COUNT));
  }

  @Test
  @DisplayName("Should drop NONE")
  void shouldDropNone() {
    AggregationSet set = AggregationSet.of(Aggregation.NONE, Aggregation.MAX);

    assertEquals(1, set.size());
    assertFalse(set.contains(Aggregation.NONE));
    assertTrue(AggregationSet.of(Aggregation.NONE).isEmpty());
  }

  @Test
  @DisplayName("Should be empty when built from nothing")
  void shouldBeEmptyWhenBuiltFromNothing() {
    assertTrue(AggregationSet.of().isEmpty());
    assertTrue(AggregationSet.of(List.of()).isEmpty());
    assertEquals(0, AggregationSet.of().size());
  }

  @Test
  @DisplayName("Should not be affected by later changes to the source collection")
  void shouldNotShareSourceCollection() {
    EnumSet<Aggregation> source = EnumSet.of(Aggregation.MIN);
    AggregationSet set = AggregationSet.of(source);

    source.add(Aggregation.MAX);

    assertFalse(set.contains(Aggregation.MAX));
    assertThrows(UnsupportedOperationException.class, () -> set.asSet().add(Aggregation.MAX));
  }

  @Test
  @DisplayName("Should compare by selected kinds regardless of order")
  void shouldCompareBySelectedKinds() {
    assertEquals(
        AggregationSet.of(Aggregation.MIN, Aggregation.MAX),
        AggregationSet.of(List.of(Aggregation.MAX, Aggregation.MIN, Aggregation.NONE)));
  }

  @Test
  @DisplayName("Should expose display names used in metadata keys")
  void shouldExposeDisplayNames() {
    assertEquals("none", Aggregation.NONE.displayName());
    assertEquals("value", Aggregation.VALUE.displayName());
    assertEquals("mean", Aggregation.MEAN.displayName());
    assertEquals("count", Aggregation.COUNT.displayName());
    assertEquals("sum", Aggregation.SUM.displayName());
    assertEquals("max", Aggregation.MAX.displayName());
    assertEquals("min", Aggregation.MIN.displayName());
  }
}

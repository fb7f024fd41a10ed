package io.windowstats.config;

import io.windowstats.stats.Aggregation;
import io.windowstats.stats.AggregationSet;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatSpec {
  private String name;
  private ValueType type = ValueType.DOUBLE;
  private List<Aggregation> aggregations = new ArrayList<>();
  private WindowSpec window;

  public enum ValueType {
    LONG,
    DOUBLE
  }

  public AggregationSet aggregationSet() {
    return AggregationSet.of(aggregations);
  }

  public void validate() {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Stat name is required");
    }
    if (type == null) {
      throw new IllegalArgumentException("Stat '" + name + "' has no value type");
    }
    if (aggregations == null || AggregationSet.of(aggregations).isEmpty()) {
      throw new IllegalArgumentException("Stat '" + name + "' selects no aggregations");
    }
    if (window == null) {
      throw new IllegalArgumentException("Stat '" + name + "' has no window");
    }
    window.validate(name);
  }
}

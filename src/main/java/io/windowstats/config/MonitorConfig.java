package io.windowstats.config;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Root of a JSON monitor configuration: the stats to create. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MonitorConfig {
  private List<StatSpec> stats = new ArrayList<>();

  public void validate() {
    if (stats == null) {
      throw new IllegalArgumentException("stats must not be null");
    }
    stats.forEach(StatSpec::validate);
  }
}

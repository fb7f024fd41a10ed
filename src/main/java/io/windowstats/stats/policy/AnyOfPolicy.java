package io.windowstats.stats.policy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.windowstats.stats.WindowState;
import java.util.List;

/** Closes the window when any delegate would, e.g. "every 10s or every 1000 values". */
public class AnyOfPolicy implements WindowPolicy {

  private final List<WindowPolicy> delegates;

  public AnyOfPolicy(WindowPolicy... delegates) {
    Preconditions.checkArgument(delegates.length > 0, "at least one policy is required");
    this.delegates = ImmutableList.copyOf(delegates);
  }

  @Override
  public boolean shouldClose(WindowState current) {
    for (WindowPolicy delegate : delegates) {
      if (delegate.shouldClose(current)) {
        return true;
      }
    }
    return false;
  }

  // every delegate sees every close so interval buckets stay in step
  @Override
  public void afterClose() {
    delegates.forEach(WindowPolicy::afterClose);
  }

  @Override
  public String toString() {
    return "AnyOfPolicy" + delegates;
  }
}

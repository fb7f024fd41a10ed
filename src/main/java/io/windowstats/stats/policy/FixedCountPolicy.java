package io.windowstats.stats.policy;

import com.google.common.base.Preconditions;
import io.windowstats.stats.WindowState;

/** Closes the window as soon as it holds {@code windowSize} observations. */
public class FixedCountPolicy implements WindowPolicy {

  private final long windowSize;

  public FixedCountPolicy(long windowSize) {
    Preconditions.checkArgument(windowSize > 0, "windowSize must be positive: %s", windowSize);
    this.windowSize = windowSize;
  }

  @Override
  public boolean shouldClose(WindowState current) {
    return current.count() >= windowSize;
  }

  public long getWindowSize() {
    return windowSize;
  }

  @Override
  public String toString() {
    return "FixedCountPolicy{windowSize=" + windowSize + "}";
  }
}

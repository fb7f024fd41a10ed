package io.windowstats.stats.policy;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import io.windowstats.stats.WindowState;
import java.time.Duration;

/**
 * Closes the window when the monotonic clock moves into a new bucket of length {@code window}.
 * Buckets are only checked when the stat is used, so a window stays open until the next {@code
 * add} after its nominal end, and any number of skipped buckets collapse into a single close.
 */
public class IntervalPolicy implements WindowPolicy {

  /** Longest window whose length fits in a {@code long} of nanoseconds. */
  public static final Duration MAX_WINDOW = Duration.ofNanos(Long.MAX_VALUE);

  private final Ticker ticker;
  private final long windowNanos;
  private long lastWindowId;

  public IntervalPolicy(Duration window) {
    this(window, Ticker.systemTicker());
  }

  public IntervalPolicy(Duration window, Ticker ticker) {
    Preconditions.checkNotNull(window, "window");
    Preconditions.checkArgument(
        !window.isNegative() && !window.isZero(), "window must be positive: %s", window);
    Preconditions.checkArgument(
        window.compareTo(MAX_WINDOW) <= 0, "window must not exceed %s: %s", MAX_WINDOW, window);
    this.ticker = Preconditions.checkNotNull(ticker, "ticker");
    this.windowNanos = window.toNanos();
    this.lastWindowId = currentWindowId();
  }

  @Override
  public boolean shouldClose(WindowState current) {
    return currentWindowId() != lastWindowId;
  }

  @Override
  public void afterClose() {
    lastWindowId = currentWindowId();
  }

  @VisibleForTesting
  long currentWindowId() {
    return Math.floorDiv(ticker.read(), windowNanos);
  }

  @Override
  public String toString() {
    return "IntervalPolicy{window=" + Duration.ofNanos(windowNanos) + "}";
  }
}

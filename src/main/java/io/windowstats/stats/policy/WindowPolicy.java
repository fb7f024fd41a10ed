package io.windowstats.stats.policy;

import io.windowstats.stats.WindowState;

/**
 * Decides when a stat closes its current window. A stat consults {@link #shouldClose} before and
 * after folding every observation, while holding its lock, and calls {@link #afterClose} once per
 * close. Instances are stateful and belong to a single stat.
 */
public interface WindowPolicy {

  boolean shouldClose(WindowState current);

  default void afterClose() {}
}

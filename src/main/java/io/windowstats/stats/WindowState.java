package io.windowstats.stats;

/** Read-only view of the window being filled, as seen by a window policy. */
public interface WindowState {

  /** Number of observations folded into the window so far. */
  long count();
}

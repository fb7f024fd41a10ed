package io.windowstats.registry;

import io.windowstats.stats.Stat;
import java.util.Collection;

/**
 * Directory of live stats. A stat registers itself when constructed and unregisters when closed;
 * both calls must be safe from any thread.
 */
public interface StatRegistry {

  void register(Stat<?> stat);

  void unregister(Stat<?> stat);

  /**
   * Snapshot of the stats registered at the time of the call. A stat is marked closed before it
   * unregisters, so the snapshot may briefly hold a closed stat; check {@link Stat#isClosed()}
   * before adding to it.
   */
  Collection<Stat<?>> stats();

  int size();
}

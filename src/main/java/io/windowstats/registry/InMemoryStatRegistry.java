package io.windowstats.registry;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.windowstats.stats.Stat;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Thread-safe registry keyed by stat identity; several stats may share a name. */
public class InMemoryStatRegistry implements StatRegistry {
  private static final Logger log = LoggerFactory.getLogger(InMemoryStatRegistry.class);

  private final Set<Stat<?>> stats = ConcurrentHashMap.newKeySet();

  @Override
  public void register(Stat<?> stat) {
    Preconditions.checkNotNull(stat, "stat");
    Preconditions.checkState(stats.add(stat), "Stat %s is already registered", stat.getName());
    log.debug("Registered stat {}", stat.getName());
  }

  @Override
  public void unregister(Stat<?> stat) {
    Preconditions.checkNotNull(stat, "stat");
    Preconditions.checkState(stats.remove(stat), "Stat %s is not registered", stat.getName());
    log.debug("Unregistered stat {}", stat.getName());
  }

  @Override
  public Collection<Stat<?>> stats() {
    return ImmutableList.copyOf(stats);
  }

  @Override
  public int size() {
    return stats.size();
  }
}

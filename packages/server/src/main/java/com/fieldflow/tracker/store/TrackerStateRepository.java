package com.fieldflow.tracker.store;

import com.fieldflow.tracker.logging.LoggingService;
import java.time.Duration;
import java.time.Instant;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;

/**
 * Reads and writes the {@link TrackerState} aggregate under a single key.
 *
 * <p>The last state handed out is cached so a failed write does not lose in-process changes; the
 * next successful write persists them.
 */
public class TrackerStateRepository {
  private static final Logger log = LoggingService.getLogger(TrackerStateRepository.class);

  public static final String STATE_KEY = "fieldflow.tracker.state";

  private final DurableStateStore store;
  private TrackerState current;

  public TrackerStateRepository(DurableStateStore store) {
    this.store = store;
  }

  public synchronized TrackerState load() {
    if (current == null) {
      current = store.get(STATE_KEY, TrackerState.class, TrackerState.empty());
      log.debug(
          "Loaded tracker state v{} ({} jobs, active={})",
          current.version(),
          current.jobs().size(),
          current.activeJobId());
    }
    return current;
  }

  /** Apply {@code change}, bump the version and persist. Returns the new state. */
  public synchronized TrackerState update(UnaryOperator<TrackerState> change) {
    TrackerState base = load();
    TrackerState next = change.apply(base).withVersion(base.version() + 1);
    current = next;
    if (!store.set(STATE_KEY, next)) {
      log.warn("Tracker state v{} kept in memory only", next.version());
    }
    return next;
  }

  public TrackerState pruneStale(Duration retention, Instant now) {
    TrackerState before = load();
    TrackerState pruned = before.pruneStale(retention, now);
    if (pruned == before) {
      return before;
    }
    log.info("Pruned {} stale job records", before.jobs().size() - pruned.jobs().size());
    return update(state -> state.pruneStale(retention, now));
  }
}

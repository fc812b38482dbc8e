package com.fieldflow.tracker.scheduling;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative, single-threaded timer service. Every task submitted here runs on the same logical
 * thread, so code executed from scheduler callbacks never needs additional locking.
 */
public interface TaskScheduler {

  /** Run {@code task} once after {@code delay}. */
  ScheduledTask schedule(Runnable task, Duration delay);

  /** Run {@code task} every {@code period}, first after {@code initialDelay}. */
  ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

  /** Run {@code task} on the scheduler thread as soon as possible. */
  void execute(Runnable task);

  Clock clock();

  default Instant now() {
    return clock().instant();
  }
}

package com.fieldflow.tracker.scheduling;

/** Handle of a one-shot or recurring task registered with a {@link TaskScheduler}. */
public interface ScheduledTask {
  /** Cancel the task. Idempotent; a task already running is allowed to finish. */
  void cancel();

  boolean isCancelled();
}

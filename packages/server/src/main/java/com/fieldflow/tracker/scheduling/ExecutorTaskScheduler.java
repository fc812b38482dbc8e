package com.fieldflow.tracker.scheduling;

import com.fieldflow.tracker.logging.LoggingService;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/** {@link TaskScheduler} backed by a single-threaded {@link ScheduledThreadPoolExecutor}. */
public final class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {
  private static final Logger log = LoggingService.getLogger(ExecutorTaskScheduler.class);

  private final ScheduledThreadPoolExecutor executor;
  private final Clock clock;

  public ExecutorTaskScheduler(String threadName) {
    this(threadName, Clock.systemUTC());
  }

  public ExecutorTaskScheduler(String threadName, Clock clock) {
    this.clock = clock;
    this.executor =
        new ScheduledThreadPoolExecutor(
            1,
            r -> {
              Thread t = new Thread(r, threadName);
              t.setDaemon(true);
              return t;
            });
    this.executor.setRemoveOnCancelPolicy(true);
    this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
  }

  @Override
  public ScheduledTask schedule(Runnable task, Duration delay) {
    return new FutureTask(
        executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS));
  }

  @Override
  public ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
    return new FutureTask(
        executor.scheduleAtFixedRate(
            guarded(task), initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS));
  }

  @Override
  public void execute(Runnable task) {
    executor.execute(guarded(task));
  }

  @Override
  public Clock clock() {
    return clock;
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  // A recurring task that throws is silently descheduled by the executor, so failures are
  // logged here and the schedule keeps running.
  private static Runnable guarded(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (Exception e) {
        log.error("Scheduled task failed", e);
      }
    };
  }

  private record FutureTask(ScheduledFuture<?> future) implements ScheduledTask {
    @Override
    public void cancel() {
      future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
      return future.isCancelled();
    }
  }
}

package com.fieldflow.tracker.scheduling;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Deterministic {@link TaskScheduler} for tests. Time only moves when {@link #advance} is called;
 * due tasks then run on the calling thread in time order.
 */
public final class ManualTaskScheduler implements TaskScheduler {
  private final PriorityQueue<Entry> queue =
      new PriorityQueue<>(Comparator.comparing((Entry e) -> e.due).thenComparingLong(e -> e.seq));
  private final MutableClock clock;
  private long sequence;

  public ManualTaskScheduler() {
    this(Instant.parse("2025-05-01T08:00:00Z"));
  }

  public ManualTaskScheduler(Instant start) {
    this.clock = new MutableClock(start);
  }

  @Override
  public ScheduledTask schedule(Runnable task, Duration delay) {
    return enqueue(task, now().plus(delay), null);
  }

  @Override
  public ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
    return enqueue(task, now().plus(initialDelay), period);
  }

  @Override
  public void execute(Runnable task) {
    enqueue(task, now(), null);
  }

  @Override
  public Clock clock() {
    return clock;
  }

  /** Run everything due up to {@code now + duration}, moving the clock along. */
  public void advance(Duration duration) {
    Instant target = now().plus(duration);
    while (!queue.isEmpty() && !queue.peek().due.isAfter(target)) {
      Entry next = queue.poll();
      if (next.cancelled) {
        continue;
      }
      clock.set(next.due);
      next.task.run();
      if (next.period != null && !next.cancelled) {
        next.due = next.due.plus(next.period);
        next.seq = sequence++;
        queue.add(next);
      }
    }
    clock.set(target);
  }

  public void advanceSeconds(long seconds) {
    advance(Duration.ofSeconds(seconds));
  }

  /** Run tasks that are due right now, including ones they enqueue. */
  public void runPending() {
    advance(Duration.ZERO);
  }

  public long pendingTasks() {
    return queue.stream().filter(e -> !e.cancelled).count();
  }

  private Entry enqueue(Runnable task, Instant due, Duration period) {
    Entry entry = new Entry(task, due, period, sequence++);
    queue.add(entry);
    return entry;
  }

  private static final class Entry implements ScheduledTask {
    final Runnable task;
    final Duration period;
    Instant due;
    long seq;
    boolean cancelled;

    Entry(Runnable task, Instant due, Duration period, long seq) {
      this.task = task;
      this.due = due;
      this.period = period;
      this.seq = seq;
    }

    @Override
    public void cancel() {
      cancelled = true;
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void set(Instant instant) {
      this.now = instant;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}

package com.fieldflow.tracker.polling;

import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.jobs.JobKind;
import com.fieldflow.tracker.jobs.VisitCounts;
import com.fieldflow.tracker.scheduling.ScheduledTask;
import java.time.Instant;

/**
 * Runtime state of one polled job. Owned by {@link JobRegistry}; only touched on the scheduler
 * thread.
 */
final class PollContext {
  final String jobId;
  final Instant startTime;

  JobListener listener;
  JobContext context;

  String lastMessage;
  VisitCounts lastVisits;
  Instant lastMessageChangeTime;
  Instant lastStatusUpdateTime;
  boolean paused;
  Instant resumeTime;
  boolean requestInFlight;

  ScheduledTask mainTimer;
  ScheduledTask informationalTimer;
  ScheduledTask activityMonitorTimer;
  ScheduledTask activityCheckTimer;
  ScheduledTask inactivityDeadlineTimer;
  ScheduledTask hardCapTimer;

  PollContext(String jobId, JobListener listener, JobContext context, Instant now) {
    this.jobId = jobId;
    this.listener = listener;
    this.context = context;
    this.startTime = now;
    this.lastMessageChangeTime = now;
  }

  JobKind kind() {
    return context == null ? JobKind.SINGLE : context.kind();
  }

  /** Start of the current inactivity window. */
  Instant inactivitySince() {
    if (resumeTime != null && resumeTime.isAfter(lastMessageChangeTime)) {
      return resumeTime;
    }
    return lastMessageChangeTime;
  }

  void clearStagedTimers() {
    informationalTimer = cancel(informationalTimer);
    activityMonitorTimer = cancel(activityMonitorTimer);
    activityCheckTimer = cancel(activityCheckTimer);
    inactivityDeadlineTimer = cancel(inactivityDeadlineTimer);
    hardCapTimer = cancel(hardCapTimer);
  }

  void clearTimers() {
    mainTimer = cancel(mainTimer);
    clearStagedTimers();
  }

  PollView view() {
    return new PollView(
        jobId,
        startTime,
        lastMessage,
        lastMessageChangeTime,
        lastStatusUpdateTime,
        paused,
        resumeTime,
        requestInFlight);
  }

  private static ScheduledTask cancel(ScheduledTask task) {
    if (task != null) {
      task.cancel();
    }
    return null;
  }
}

package com.fieldflow.tracker.jobs;

import java.time.Instant;
import java.util.Objects;

/**
 * Externally visible state of one automation job. Instances are immutable; every transition
 * returns a new record whose {@code statusChanged}, {@code justCompleted} and {@code justErrored}
 * flags describe that single step. The flags are meant to be consumed once by the UI layer and
 * are never persisted.
 *
 * <p>Status moves only forward ({@code idle -> running -> completed | error}). Once a record is
 * terminal every further update is ignored. Pausing is orthogonal to the status: a paused job
 * stays {@code running} and carries a {@code pauseReason}.
 */
public record JobRecord(
    String jobId,
    JobStatus status,
    String message,
    Instant startTime,
    Instant endTime,
    Instant lastUpdateTime,
    JobContext context,
    VisitCounts visits,
    String pauseReason,
    boolean statusChanged,
    boolean justCompleted,
    boolean justErrored) {

  public static final String STOPPED_BY_USER = "stopped by user";
  public static final String DEFAULT_PAUSE_REASON = "Paused";
  static final String DEFAULT_COMPLETION_MESSAGE = "Automation completed successfully";

  public JobRecord {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(startTime, "startTime");
  }

  /** A freshly allocated record for a job the remote service has not accepted yet. */
  public static JobRecord pending(JobContext context, Instant now) {
    return new JobRecord(
        null,
        JobStatus.IDLE,
        "Starting process...",
        now,
        null,
        null,
        context,
        null,
        null,
        false,
        false,
        false);
  }

  public static JobRecord fromSnapshot(JobSnapshot snapshot) {
    return new JobRecord(
        snapshot.jobId(),
        snapshot.status(),
        snapshot.message(),
        snapshot.startTime(),
        snapshot.endTime(),
        snapshot.lastUpdateTime(),
        snapshot.context(),
        snapshot.visits(),
        snapshot.isTerminal() ? null : snapshot.pauseReason(),
        false,
        false,
        false);
  }

  public JobSnapshot toSnapshot() {
    return new JobSnapshot(
        jobId, status, message, startTime, endTime, lastUpdateTime, context, visits, pauseReason);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  public boolean isPaused() {
    return pauseReason != null;
  }

  public JobKind kind() {
    return context.kind();
  }

  /** The remote service accepted the job and issued {@code newJobId}. */
  public JobRecord started(String newJobId, String startMessage) {
    if (status != JobStatus.IDLE) {
      return withoutFlags();
    }
    String msg = startMessage == null || startMessage.isBlank() ? message : startMessage;
    return new JobRecord(
        newJobId,
        JobStatus.RUNNING,
        msg,
        startTime,
        null,
        null,
        context,
        visits,
        null,
        true,
        false,
        false);
  }

  public JobRecord apply(JobStatus reported, String reportedMessage, Instant now) {
    return apply(reported, reportedMessage, null, now);
  }

  /**
   * Apply one status observation from the remote service.
   *
   * <p>An {@code idle} report never moves a job backwards; only its message is taken. The very
   * first observation of a job always counts as a status change because the start response
   * carries no status of its own. Missing visit counters keep the last known ones.
   */
  public JobRecord apply(
      JobStatus reported, String reportedMessage, VisitCounts reportedVisits, Instant now) {
    if (isTerminal()) {
      return withoutFlags();
    }
    JobStatus next = reported == null || reported == JobStatus.IDLE ? status : reported;
    String nextMessage = reportedMessage;
    if (nextMessage == null || nextMessage.isEmpty()) {
      nextMessage = next == JobStatus.COMPLETED ? DEFAULT_COMPLETION_MESSAGE : message;
    }
    boolean changed = next != status || lastUpdateTime == null;
    Instant nextEnd = next.isTerminal() ? now : null;
    return new JobRecord(
        jobId,
        next,
        nextMessage,
        startTime,
        nextEnd,
        now,
        context,
        reportedVisits == null ? visits : reportedVisits,
        next.isTerminal() ? null : pauseReason,
        changed,
        next != status && next == JobStatus.COMPLETED,
        next != status && next == JobStatus.ERROR);
  }

  /**
   * True when {@code other} differs from this record in anything but its update time and flags,
   * i.e. when an observation carried new information worth persisting.
   */
  public boolean sameContentAs(JobRecord other) {
    return other != null
        && Objects.equals(jobId, other.jobId)
        && status == other.status
        && Objects.equals(message, other.message)
        && Objects.equals(endTime, other.endTime)
        && Objects.equals(visits, other.visits)
        && Objects.equals(pauseReason, other.pauseReason);
  }

  /** Move straight to {@code error}; used for start failures and user cancellation. */
  public JobRecord fail(String reason, Instant now) {
    if (isTerminal()) {
      return withoutFlags();
    }
    return new JobRecord(
        jobId,
        JobStatus.ERROR,
        reason,
        startTime,
        now,
        lastUpdateTime,
        context,
        visits,
        null,
        true,
        false,
        true);
  }

  public JobRecord cancelled(Instant now) {
    return fail(STOPPED_BY_USER, now);
  }

  /** Mark a running job as paused. A blank reason reads as {@value #DEFAULT_PAUSE_REASON}. */
  public JobRecord paused(String reason, Instant now) {
    if (isTerminal()) {
      return withoutFlags();
    }
    String nextReason = reason == null || reason.isBlank() ? DEFAULT_PAUSE_REASON : reason;
    return new JobRecord(
        jobId,
        status,
        message,
        startTime,
        endTime,
        now,
        context,
        visits,
        nextReason,
        false,
        false,
        false);
  }

  public JobRecord resumed(Instant now) {
    if (isTerminal() || !isPaused()) {
      return withoutFlags();
    }
    return new JobRecord(
        jobId,
        status,
        message,
        startTime,
        endTime,
        now,
        context,
        visits,
        null,
        false,
        false,
        false);
  }

  public JobRecord withoutFlags() {
    if (!statusChanged && !justCompleted && !justErrored) {
      return this;
    }
    return new JobRecord(
        jobId,
        status,
        message,
        startTime,
        endTime,
        lastUpdateTime,
        context,
        visits,
        pauseReason,
        false,
        false,
        false);
  }
}

package com.fieldflow.tracker.polling;

import com.fieldflow.tracker.jobs.JobKind;
import com.fieldflow.tracker.jobs.JobStatus;
import com.fieldflow.tracker.logging.LoggingService;
import com.fieldflow.tracker.progress.ActivityDetector;
import com.fieldflow.tracker.remote.AutomationStatus;
import com.fieldflow.tracker.scheduling.TaskScheduler;
import java.time.Duration;
import java.time.Instant;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Staged watchers that end a job when the remote service stops reporting progress.
 *
 * <ul>
 *   <li>informational delay: logs the current message, nothing else;
 *   <li>activity monitor delay: first activity check, then one every check period. A job whose
 *       message carries an activity marker or changed recently is left alone; otherwise it is
 *       force-completed once it has been inactive for the inactivity limit. Between two checks a
 *       one-shot deadline fires exactly when the limit is reached;
 *   <li>hard cap: force-completes whatever is still running. Batch jobs run one visit after the
 *       other for as long as the list takes, so they get no hard cap.
 * </ul>
 *
 * Force-completion reports {@code completed} with the last known message. The remote service
 * never confirmed it, so a stuck job looks exactly like a finished one.
 */
final class CompletionHeuristicEngine {
  private static final Logger log = LoggingService.getLogger(CompletionHeuristicEngine.class);

  static final String FALLBACK_MESSAGE = "Processing completed";

  private final JobRegistry registry;
  private final TaskScheduler scheduler;
  private final PollingSettings settings;
  private final ActivityDetector detector;

  CompletionHeuristicEngine(
      JobRegistry registry,
      TaskScheduler scheduler,
      PollingSettings settings,
      ActivityDetector detector) {
    this.registry = registry;
    this.scheduler = scheduler;
    this.settings = settings;
    this.detector = detector;
  }

  /** (Re)arm the staged timers of {@code ctx} relative to now. */
  void arm(PollContext ctx) {
    ctx.clearStagedTimers();
    ctx.informationalTimer =
        scheduler.schedule(() -> informational(ctx), settings.informationalDelay());
    ctx.activityMonitorTimer =
        scheduler.schedule(() -> startActivityMonitor(ctx), settings.activityMonitorDelay());
    if (ctx.kind() != JobKind.BATCH) {
      ctx.hardCapTimer = scheduler.schedule(() -> hardCap(ctx), settings.hardCap());
    }
  }

  ActivityAssessment assess(PollContext ctx, Instant now) {
    Duration inactiveFor = Duration.between(ctx.inactivitySince(), now);
    boolean recent = inactiveFor.compareTo(settings.recentActivityWindow()) < 0;
    return new ActivityAssessment(detector.isActive(ctx.lastMessage), inactiveFor, recent);
  }

  private void informational(PollContext ctx) {
    if (!registry.isLive(ctx)) {
      return;
    }
    log.info(
        "Job {} after {}s: {}",
        ctx.jobId,
        Duration.between(ctx.startTime, scheduler.now()).toSeconds(),
        StringUtils.defaultIfBlank(ctx.lastMessage, "<no status yet>"));
  }

  private void startActivityMonitor(PollContext ctx) {
    if (!registry.isLive(ctx)) {
      return;
    }
    check(ctx);
    if (registry.isLive(ctx)) {
      ctx.activityCheckTimer =
          scheduler.scheduleAtFixedRate(
              () -> check(ctx), settings.activityCheckPeriod(), settings.activityCheckPeriod());
    }
  }

  private void check(PollContext ctx) {
    if (!registry.isLive(ctx)) {
      return;
    }
    ActivityAssessment assessment = assess(ctx, scheduler.now());
    if (assessment.active()) {
      log.debug(
          "Job {} active (marker={}, idle {}s)",
          ctx.jobId,
          assessment.markerPresent(),
          assessment.inactiveFor().toSeconds());
      return;
    }
    Duration remaining = settings.inactivityLimit().minus(assessment.inactiveFor());
    if (remaining.isZero() || remaining.isNegative()) {
      forceComplete(
          ctx, "no progress for %ds".formatted(assessment.inactiveFor().toSeconds()));
      return;
    }
    if (ctx.inactivityDeadlineTimer != null) {
      ctx.inactivityDeadlineTimer.cancel();
    }
    ctx.inactivityDeadlineTimer = scheduler.schedule(() -> check(ctx), remaining);
    log.debug(
        "Job {} idle for {}s, deadline in {}s",
        ctx.jobId,
        assessment.inactiveFor().toSeconds(),
        remaining.toSeconds());
  }

  private void hardCap(PollContext ctx) {
    if (!registry.isLive(ctx)) {
      return;
    }
    ActivityAssessment assessment = assess(ctx, scheduler.now());
    if (assessment.active() && settings.hardCapRespectsActivity()) {
      log.warn("Job {} reached the hard cap but is still active, leaving it running", ctx.jobId);
      return;
    }
    forceComplete(
        ctx,
        "hard cap of %ds reached (active=%s)"
            .formatted(settings.hardCap().toSeconds(), assessment.active()));
  }

  private void forceComplete(PollContext ctx, String reason) {
    String message = StringUtils.defaultIfBlank(ctx.lastMessage, FALLBACK_MESSAGE);
    if (registry.finish(ctx, AutomationStatus.of(JobStatus.COMPLETED, message))) {
      log.warn("Force-completed job {}: {}", ctx.jobId, reason);
    }
  }
}

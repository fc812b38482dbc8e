package com.fieldflow.tracker.polling;

import com.fieldflow.tracker.exception.RemoteServiceException;
import com.fieldflow.tracker.exception.TrackerException;
import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.jobs.JobStatus;
import com.fieldflow.tracker.logging.LoggingService;
import com.fieldflow.tracker.progress.ActivityDetector;
import com.fieldflow.tracker.remote.AutomationClient;
import com.fieldflow.tracker.remote.AutomationStatus;
import com.fieldflow.tracker.scheduling.TaskScheduler;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * In-memory table of polled jobs, at most one {@link PollContext} per job id. The registry owns
 * every timer of a job: the main poll timer driven by {@link StatusPoller} and the staged timers
 * driven by {@link CompletionHeuristicEngine}.
 *
 * <p>Lifecycle operations are meant to run on the scheduler thread. {@link #stopPolling} may be
 * called from anywhere: removing the entry from the map is what decides which terminal path wins,
 * so the loser of a race always observes a missing context and does nothing.
 */
public class JobRegistry {
  private static final Logger log = LoggingService.getLogger(JobRegistry.class);

  private final ConcurrentMap<String, PollContext> contexts = new ConcurrentHashMap<>();
  private final TaskScheduler scheduler;
  private final PollingSettings settings;
  private final StatusPoller poller;
  private final CompletionHeuristicEngine heuristics;

  public JobRegistry(
      TaskScheduler scheduler,
      AutomationClient client,
      PollingSettings settings,
      ActivityDetector activityDetector) {
    this.scheduler = scheduler;
    this.settings = settings;
    this.poller = new StatusPoller(this, client, scheduler);
    this.heuristics = new CompletionHeuristicEngine(this, scheduler, settings, activityDetector);
  }

  /**
   * Start polling {@code jobId}. A paused context is resumed with the new listener and context and
   * its heuristic timers re-armed relative to now; an active context is left alone.
   *
   * @return {@code true} if a context was created or resumed
   */
  public boolean startPolling(String jobId, JobListener listener, JobContext context) {
    if (StringUtils.isBlank(jobId)) {
      throw new IllegalArgumentException("jobId must not be blank");
    }
    Objects.requireNonNull(listener, "listener");

    PollContext existing = contexts.get(jobId);
    if (existing != null) {
      if (!existing.paused) {
        log.debug("Job {} is already being polled", jobId);
        return false;
      }
      existing.listener = listener;
      existing.context = context;
      existing.paused = false;
      existing.resumeTime = scheduler.now();
      arm(existing);
      log.info("Resumed polling job {}", jobId);
      return true;
    }

    PollContext ctx = new PollContext(jobId, listener, context, scheduler.now());
    contexts.put(jobId, ctx);
    arm(ctx);
    log.info("Started polling job {} every {} ms", jobId, settings.interval().toMillis());
    return true;
  }

  /** Clear every timer of {@code jobId} but keep its state for a later resume. */
  public boolean pausePolling(String jobId) {
    PollContext ctx = contexts.get(jobId);
    if (ctx == null || ctx.paused) {
      return false;
    }
    ctx.paused = true;
    ctx.clearTimers();
    log.info("Paused polling job {}", jobId);
    return true;
  }

  /**
   * Forget {@code jobId}: the entry is removed first, then its timers are cleared. Safe to call
   * repeatedly.
   *
   * @return {@code true} if this call removed the context
   */
  public boolean stopPolling(String jobId) {
    if (jobId == null) {
      return false;
    }
    PollContext ctx = contexts.remove(jobId);
    if (ctx == null) {
      return false;
    }
    ctx.clearTimers();
    log.info("Stopped polling job {}", jobId);
    return true;
  }

  public void stopAll() {
    List.copyOf(contexts.keySet()).forEach(this::stopPolling);
  }

  public void pauseAll() {
    List.copyOf(contexts.keySet()).forEach(this::pausePolling);
  }

  public boolean isPolling(String jobId) {
    PollContext ctx = jobId == null ? null : contexts.get(jobId);
    return ctx != null && !ctx.paused;
  }

  public boolean isPaused(String jobId) {
    PollContext ctx = jobId == null ? null : contexts.get(jobId);
    return ctx != null && ctx.paused;
  }

  /** Ids of every tracked job, paused ones included. */
  public Set<String> activeJobIds() {
    return new TreeSet<>(contexts.keySet());
  }

  public Optional<PollView> view(String jobId) {
    PollContext ctx = jobId == null ? null : contexts.get(jobId);
    return Optional.ofNullable(ctx).map(PollContext::view);
  }

  // ---------------------------------------------------------------------------------------------
  // Used by the poller and the heuristic engine
  // ---------------------------------------------------------------------------------------------

  /** True while {@code ctx} is still the registered, unpaused context of its job. */
  boolean isLive(PollContext ctx) {
    return !ctx.paused && contexts.get(ctx.jobId) == ctx;
  }

  /**
   * Terminal path shared by the poller and the heuristics. Removes {@code ctx}, then delivers the
   * final update followed by the completion or error callback. Does nothing if another path
   * already removed the context.
   */
  boolean finish(PollContext ctx, AutomationStatus finalStatus) {
    if (!contexts.remove(ctx.jobId, ctx)) {
      log.debug("Job {} already finished, dropping {}", ctx.jobId, finalStatus.status());
      return false;
    }
    ctx.clearTimers();

    JobListener listener = ctx.listener;
    invoke(ctx, "onUpdate", () -> listener.onUpdate(finalStatus));
    if (finalStatus.status() == JobStatus.COMPLETED) {
      log.info("Job {} completed: {}", ctx.jobId, finalStatus.message());
      invoke(ctx, "onComplete", listener::onComplete);
    } else {
      TrackerException error =
          new RemoteServiceException(
                  StringUtils.defaultIfBlank(finalStatus.message(), "Automation failed"))
              .withContext("jobId", ctx.jobId);
      log.warn("Job {} failed: {}", ctx.jobId, error.getMessage());
      invoke(ctx, "onError", () -> listener.onError(error));
    }
    return true;
  }

  void deliverUpdate(PollContext ctx, AutomationStatus status) {
    invoke(ctx, "onUpdate", () -> ctx.listener.onUpdate(status));
  }

  private void arm(PollContext ctx) {
    ctx.mainTimer =
        scheduler.scheduleAtFixedRate(
            () -> poller.tick(ctx), settings.interval(), settings.interval());
    heuristics.arm(ctx);
  }

  // A faulty listener must not break the timers of other jobs.
  private static void invoke(PollContext ctx, String callback, Runnable call) {
    try {
      call.run();
    } catch (RuntimeException e) {
      log.error("Listener {} for job {} failed", callback, ctx.jobId, e);
    }
  }
}

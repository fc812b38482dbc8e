package com.fieldflow.tracker.polling;

import com.fieldflow.tracker.exception.ExceptionUtil;
import com.fieldflow.tracker.jobs.VisitCounts;
import com.fieldflow.tracker.logging.LoggingService;
import com.fieldflow.tracker.remote.AutomationClient;
import com.fieldflow.tracker.remote.AutomationStatus;
import com.fieldflow.tracker.scheduling.TaskScheduler;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;

/**
 * Issues the periodic status request of every polled job. Requests never block the scheduler;
 * results are handed back to the scheduler thread before they touch any state.
 */
final class StatusPoller {
  private static final Logger log = LoggingService.getLogger(StatusPoller.class);

  private final JobRegistry registry;
  private final AutomationClient client;
  private final TaskScheduler scheduler;

  StatusPoller(JobRegistry registry, AutomationClient client, TaskScheduler scheduler) {
    this.registry = registry;
    this.client = client;
    this.scheduler = scheduler;
  }

  void tick(PollContext ctx) {
    if (!registry.isLive(ctx)) {
      return;
    }
    if (ctx.requestInFlight) {
      log.trace("Status request for job {} still outstanding, skipping tick", ctx.jobId);
      return;
    }
    ctx.requestInFlight = true;

    CompletableFuture<AutomationStatus> request;
    try {
      request = client.status(ctx.jobId, ctx.kind());
    } catch (RuntimeException e) {
      request = CompletableFuture.failedFuture(e);
    }
    request.whenComplete(
        (status, error) -> scheduler.execute(() -> onResult(ctx, status, error)));
  }

  private void onResult(PollContext ctx, AutomationStatus status, Throwable error) {
    ctx.requestInFlight = false;
    if (!registry.isLive(ctx)) {
      log.debug("Dropping status of job {}, no longer polled", ctx.jobId);
      return;
    }
    if (error != null) {
      // Transient: the next tick retries and the inactivity clock is left alone.
      log.warn(
          "Status request for job {} failed: {}",
          ctx.jobId,
          ExceptionUtil.extractErrorMessage(error));
      return;
    }

    Instant now = scheduler.now();
    String message = status.message();
    if (message != null && !Objects.equals(message, ctx.lastMessage)) {
      ctx.lastMessage = message;
      ctx.lastMessageChangeTime = now;
      log.debug("Job {}: {}", ctx.jobId, message);
    }
    VisitCounts visits = status.visits();
    if (visits != null && !visits.equals(ctx.lastVisits)) {
      // A finished visit is progress even when the message stays the same.
      ctx.lastVisits = visits;
      ctx.lastMessageChangeTime = now;
    }
    ctx.lastStatusUpdateTime = now;

    if (status.status().isTerminal()) {
      registry.finish(ctx, status);
    } else {
      registry.deliverUpdate(ctx, status);
    }
  }
}

package com.fieldflow.tracker.remote;

import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.jobs.JobKind;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking access to the remote automation service. Futures fail with {@link
 * com.fieldflow.tracker.exception.NetworkException} on transport problems and with {@link
 * com.fieldflow.tracker.exception.RemoteServiceException} when the service answers with a failure.
 * Callbacks may complete on any thread.
 */
public interface AutomationClient {

  /**
   * Ask the service to begin processing {@code context}, as a single visit or as a batch
   * depending on its kind. Completes once a job id is issued.
   */
  CompletableFuture<StartResponse> start(JobContext context);

  /** Current status of {@code jobId}. Idempotent and safe to call at high frequency. */
  CompletableFuture<AutomationStatus> status(String jobId, JobKind kind);

  default CompletableFuture<AutomationStatus> status(String jobId) {
    return status(jobId, JobKind.SINGLE);
  }

  /** Request cooperative cancellation; completes only if the service acknowledged it. */
  CompletableFuture<CommandResponse> cancel(String jobId);

  /** Ask the service to hold {@code jobId}; completes only if the service acknowledged it. */
  CompletableFuture<CommandResponse> pause(String jobId, String reason);

  /** Let a held job continue; completes only if the service acknowledged it. */
  CompletableFuture<CommandResponse> resume(String jobId);

  /**
   * Ask the service to forget finished jobs of {@code kind}, or of every kind when {@code kind}
   * is null.
   */
  CompletableFuture<CommandResponse> clearHistory(JobKind kind);
}

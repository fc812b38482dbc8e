package com.fieldflow.tracker.lifecycle;

import com.fieldflow.tracker.exception.CancellationFailedException;
import com.fieldflow.tracker.exception.ExceptionUtil;
import com.fieldflow.tracker.exception.JobCommandFailedException;
import com.fieldflow.tracker.exception.RemoteServiceException;
import com.fieldflow.tracker.exception.StateException;
import com.fieldflow.tracker.exception.TrackerException;
import com.fieldflow.tracker.exception.ValidationException;
import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.jobs.JobKind;
import com.fieldflow.tracker.jobs.JobRecord;
import com.fieldflow.tracker.jobs.JobSnapshot;
import com.fieldflow.tracker.logging.LoggingService;
import com.fieldflow.tracker.polling.JobListener;
import com.fieldflow.tracker.polling.JobRegistry;
import com.fieldflow.tracker.remote.AutomationClient;
import com.fieldflow.tracker.remote.AutomationStatus;
import com.fieldflow.tracker.remote.CommandResponse;
import com.fieldflow.tracker.remote.StartResponse;
import com.fieldflow.tracker.scheduling.ScheduledTask;
import com.fieldflow.tracker.scheduling.TaskScheduler;
import com.fieldflow.tracker.store.TrackerState;
import com.fieldflow.tracker.store.TrackerStateRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Public entry point of job tracking: starts single and batch jobs, pauses, resumes and cancels
 * them, and picks them up again after a restart. Keeps the in-memory {@link JobRecord}s, mirrors
 * them into the durable state and notifies {@link JobUpdateListener}s.
 *
 * <p>Finished records older than the retention are dropped at reconciliation, when a job starts
 * and on every {@linkplain #startHousekeeping housekeeping} run.
 *
 * <p>Every state change runs on the scheduler thread. The returned futures complete there as well.
 */
public class LifecycleController {
  private static final Logger log = LoggingService.getLogger(LifecycleController.class);

  private final TaskScheduler scheduler;
  private final AutomationClient client;
  private final JobRegistry registry;
  private final TrackerStateRepository repository;
  private final Duration retention;

  private final Map<String, JobRecord> records = new ConcurrentHashMap<>();
  // Jobs the remote service never accepted have no id to key them by.
  private final List<JobRecord> rejected = new CopyOnWriteArrayList<>();
  private final List<JobUpdateListener> listeners = new CopyOnWriteArrayList<>();

  public LifecycleController(
      TaskScheduler scheduler,
      AutomationClient client,
      JobRegistry registry,
      TrackerStateRepository repository,
      Duration retention) {
    this.scheduler = scheduler;
    this.client = client;
    this.registry = registry;
    this.repository = repository;
    this.retention = retention;
  }

  public void addListener(JobUpdateListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Ask the remote service to run a new job and start polling it.
   *
   * <p>The future completes with the record once the start request settled: {@code running} on
   * success, {@code error} with the failure reason otherwise. Only a successful start persists an
   * active job id.
   */
  public CompletableFuture<JobRecord> start(JobContext context) {
    if (context == null || StringUtils.isBlank(context.targetUrl())) {
      return CompletableFuture.failedFuture(new ValidationException("targetUrl is required"));
    }
    CompletableFuture<JobRecord> result = new CompletableFuture<>();
    scheduler.execute(
        () -> {
          JobRecord pending = JobRecord.pending(context, scheduler.now());
          notifyListeners(pending);
          call(() -> client.start(context))
              .whenComplete(
                  (response, error) ->
                      scheduler.execute(() -> onStarted(pending, response, error, result)));
        });
    return result;
  }

  /**
   * Ask the remote service to stop {@code jobId}. On success polling stops, the record becomes
   * {@code error}/"stopped by user" and the persisted active job is cleared. On failure the future
   * completes with {@link CancellationFailedException} and nothing else changes.
   *
   * <p>Completes with {@code null} when the job is unknown to this process.
   */
  public CompletableFuture<JobRecord> cancel(String jobId) {
    if (StringUtils.isBlank(jobId)) {
      return CompletableFuture.failedFuture(new ValidationException("jobId is required"));
    }
    CompletableFuture<JobRecord> result = new CompletableFuture<>();
    call(() -> client.cancel(jobId))
        .whenComplete(
            (response, error) ->
                scheduler.execute(() -> onCancelled(jobId, response, error, result)));
    return result;
  }

  /**
   * Ask the remote service to hold {@code jobId}. On success polling is paused and the record
   * carries {@code reason} (or "Paused") until it is resumed. On failure the future completes with
   * {@link JobCommandFailedException} and nothing changes; a finished job fails with {@link
   * StateException}.
   *
   * <p>Completes with {@code null} when the job is unknown to this process.
   */
  public CompletableFuture<JobRecord> pause(String jobId, String reason) {
    if (StringUtils.isBlank(jobId)) {
      return CompletableFuture.failedFuture(new ValidationException("jobId is required"));
    }
    CompletableFuture<JobRecord> result = new CompletableFuture<>();
    scheduler.execute(
        () -> {
          JobRecord current = records.get(jobId);
          if (current == null || current.isPaused()) {
            result.complete(current == null ? null : current.withoutFlags());
            return;
          }
          if (current.isTerminal()) {
            result.completeExceptionally(finished(current));
            return;
          }
          call(() -> client.pause(jobId, reason))
              .whenComplete(
                  (response, error) ->
                      scheduler.execute(() -> onPaused(jobId, reason, error, result)));
        });
    return result;
  }

  /**
   * Let a paused job continue: the remote service is told first, then polling resumes with fresh
   * heuristic timers. Fails with {@link StateException} when the job is finished or not paused.
   *
   * <p>Completes with {@code null} when the job is unknown to this process.
   */
  public CompletableFuture<JobRecord> resume(String jobId) {
    if (StringUtils.isBlank(jobId)) {
      return CompletableFuture.failedFuture(new ValidationException("jobId is required"));
    }
    CompletableFuture<JobRecord> result = new CompletableFuture<>();
    scheduler.execute(
        () -> {
          JobRecord current = records.get(jobId);
          if (current == null) {
            result.complete(null);
            return;
          }
          if (current.isTerminal()) {
            result.completeExceptionally(finished(current));
            return;
          }
          if (!current.isPaused() && !registry.isPaused(jobId)) {
            result.completeExceptionally(new StateException("Job " + jobId + " is not paused"));
            return;
          }
          call(() -> client.resume(jobId))
              .whenComplete(
                  (response, error) -> scheduler.execute(() -> onResumed(jobId, error, result)));
        });
    return result;
  }

  /**
   * Forget finished jobs of {@code kind}, or of every kind when {@code kind} is null. Running and
   * paused jobs are kept. Local records go first; the remote service is then asked to clear its
   * own history, and a failure there is only logged.
   */
  public CompletableFuture<HistoryCleared> clearHistory(JobKind kind) {
    CompletableFuture<HistoryCleared> result = new CompletableFuture<>();
    scheduler.execute(
        () -> {
          Predicate<JobSnapshot> finished =
              job ->
                  job.isTerminal()
                      && job.context() != null
                      && (kind == null || job.context().kind() == kind);
          int removed = dropRecords(finished);
          repository.update(state -> state.withoutJobs(finished));
          log.info(
              "Cleared {} finished {} jobs",
              removed,
              kind == null ? "single and batch" : kind.wireValue());
          call(() -> client.clearHistory(kind))
              .whenComplete(
                  (response, error) ->
                      scheduler.execute(
                          () -> {
                            if (error != null) {
                              log.warn(
                                  "Automation service kept its job history: {}",
                                  ExceptionUtil.extractErrorMessage(error));
                            }
                            result.complete(new HistoryCleared(removed, error == null));
                          }));
        });
    return result;
  }

  /**
   * Drop finished records older than the retention every {@code period}, from the durable state
   * and from memory alike.
   */
  public ScheduledTask startHousekeeping(Duration period) {
    log.info(
        "Pruning finished jobs older than {} h every {} min",
        retention.toHours(),
        period.toMinutes());
    return scheduler.scheduleAtFixedRate(this::pruneStale, period, period);
  }

  /**
   * Re-synchronise with the remote service after a restart. Stale records are pruned first. Every
   * job left unfinished is queried once before any of its timers is started again; several jobs
   * may be outstanding at once.
   */
  public CompletableFuture<ReconcileOutcome> reconcileOnResume() {
    CompletableFuture<ReconcileOutcome> result = new CompletableFuture<>();
    scheduler.execute(
        () -> {
          try {
            reconcile(result);
          } catch (RuntimeException e) {
            result.completeExceptionally(e);
          }
        });
    return result;
  }

  /** Pause every poll context before the process goes away. Persisted flags are kept. */
  public CompletableFuture<Void> suspend() {
    CompletableFuture<Void> result = new CompletableFuture<>();
    scheduler.execute(
        () -> {
          registry.pauseAll();
          log.info("Suspended job tracking");
          result.complete(null);
        });
    return result;
  }

  public Optional<JobRecord> record(String jobId) {
    return jobId == null ? Optional.empty() : Optional.ofNullable(records.get(jobId));
  }

  /** All known records, oldest first. */
  public List<JobRecord> records() {
    List<JobRecord> all = new ArrayList<>(records.values());
    all.addAll(rejected);
    all.sort(Comparator.comparing(JobRecord::startTime));
    return all;
  }

  public JobRegistry registry() {
    return registry;
  }

  // ---------------------------------------------------------------------------------------------

  private void onStarted(
      JobRecord pending,
      StartResponse response,
      Throwable error,
      CompletableFuture<JobRecord> out) {
    Instant now = scheduler.now();
    if (error == null && (response == null || StringUtils.isBlank(response.jobId()))) {
      error = new RemoteServiceException("Automation service did not issue a job id");
    }
    if (error != null) {
      String reason = ExceptionUtil.extractErrorMessage(error);
      log.error("Failed to start automation for {}: {}", pending.context().targetUrl(), reason);
      JobRecord failed = pending.fail(reason, now);
      rejected.add(failed);
      repository.update(state -> state.withJob(failed.toSnapshot()));
      notifyListeners(failed);
      out.complete(failed);
      return;
    }

    pruneStale();
    JobRecord running = pending.started(response.jobId(), response.message());
    String jobId = running.jobId();
    records.put(jobId, running);
    repository.update(state -> state.withJob(running.toSnapshot()).withActiveJob(jobId, true));
    registry.startPolling(jobId, new RecordUpdater(jobId), running.context());
    log.info(
        "{} job {} started for {}",
        running.kind() == JobKind.BATCH ? "Batch" : "Single",
        jobId,
        running.context().targetUrl());
    notifyListeners(running);
    out.complete(running);
  }

  private void onCancelled(
      String jobId, CommandResponse response, Throwable error, CompletableFuture<JobRecord> out) {
    if (error != null) {
      String reason = ExceptionUtil.extractErrorMessage(error);
      log.warn("Cancel of job {} failed: {}", jobId, reason);
      out.completeExceptionally(
          new CancellationFailedException(jobId, reason, ExceptionUtil.unwrap(error)));
      return;
    }

    registry.stopPolling(jobId);
    JobRecord current = records.get(jobId);
    if (current == null) {
      current = repository.load().job(jobId).map(JobRecord::fromSnapshot).orElse(null);
    }
    JobRecord cancelled = current == null ? null : current.cancelled(scheduler.now());
    if (cancelled != null) {
      records.put(jobId, cancelled);
    }
    repository.update(
        state -> {
          TrackerState next = cancelled == null ? state : state.withJob(cancelled.toSnapshot());
          return jobId.equals(next.activeJobId()) ? next.clearActiveJob() : next;
        });
    log.info("Job {} stopped by user ({})", jobId, response.message());
    if (cancelled != null) {
      notifyListeners(cancelled);
    }
    out.complete(cancelled);
  }

  private void onPaused(
      String jobId, String reason, Throwable error, CompletableFuture<JobRecord> out) {
    if (error != null) {
      String message = ExceptionUtil.extractErrorMessage(error);
      log.warn("Pause of job {} failed: {}", jobId, message);
      out.completeExceptionally(
          new JobCommandFailedException(jobId, "pause", message, ExceptionUtil.unwrap(error)));
      return;
    }
    JobRecord current = records.get(jobId);
    if (current == null || current.isTerminal()) {
      // Finished while the request was outstanding.
      out.complete(current);
      return;
    }
    registry.pausePolling(jobId);
    JobRecord paused = current.paused(reason, scheduler.now());
    records.put(jobId, paused);
    repository.update(state -> state.withJob(paused.toSnapshot()));
    log.info("Job {} paused: {}", jobId, paused.pauseReason());
    notifyListeners(paused);
    out.complete(paused);
  }

  private void onResumed(String jobId, Throwable error, CompletableFuture<JobRecord> out) {
    if (error != null) {
      String message = ExceptionUtil.extractErrorMessage(error);
      log.warn("Resume of job {} failed: {}", jobId, message);
      out.completeExceptionally(
          new JobCommandFailedException(jobId, "resume", message, ExceptionUtil.unwrap(error)));
      return;
    }
    JobRecord current = records.get(jobId);
    if (current == null || current.isTerminal()) {
      out.complete(current);
      return;
    }
    JobRecord resumed = current.resumed(scheduler.now());
    records.put(jobId, resumed);
    repository.update(state -> state.withJob(resumed.toSnapshot()));
    registry.startPolling(jobId, new RecordUpdater(jobId), resumed.context());
    log.info("Job {} resumed", jobId);
    notifyListeners(resumed);
    out.complete(resumed);
  }

  private void reconcile(CompletableFuture<ReconcileOutcome> out) {
    TrackerState state = pruneStale();
    restoreRecords(state);
    List<String> outstanding = state.outstandingJobIds();
    if (outstanding.isEmpty()) {
      log.debug("No outstanding job to reconcile");
      out.complete(ReconcileOutcome.nothingOutstanding());
      return;
    }

    log.info(
        "Reconciling {} job(s) with the automation service: {}", outstanding.size(), outstanding);
    Map<String, ReconcileOutcome.Disposition> dispositions = new LinkedHashMap<>();
    List<CompletableFuture<Void>> pending = new ArrayList<>();
    for (String jobId : outstanding) {
      JobRecord known = records.get(jobId);
      if (known == null) {
        log.warn("Outstanding job {} has no persisted record, clearing it", jobId);
        clearActiveJob(jobId);
        dispositions.put(jobId, ReconcileOutcome.Disposition.FINALIZED);
        continue;
      }
      if (registry.isPolling(jobId)) {
        dispositions.put(jobId, ReconcileOutcome.Disposition.RESUMED);
        continue;
      }
      // Reserve the slot so the report keeps the persisted order.
      dispositions.put(jobId, null);
      CompletableFuture<Void> done = new CompletableFuture<>();
      pending.add(done);
      call(() -> client.status(jobId, known.kind()))
          .whenComplete(
              (status, error) ->
                  scheduler.execute(
                      () -> {
                        try {
                          dispositions.put(jobId, onReconciled(jobId, status, error));
                          done.complete(null);
                        } catch (RuntimeException e) {
                          done.completeExceptionally(e);
                        }
                      }));
    }
    CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new))
        .whenComplete(
            (ignored, error) -> {
              if (error != null) {
                out.completeExceptionally(ExceptionUtil.unwrap(error));
              } else {
                out.complete(ReconcileOutcome.of(dispositions));
              }
            });
  }

  private ReconcileOutcome.Disposition onReconciled(
      String jobId, AutomationStatus status, Throwable error) {
    JobRecord current = records.get(jobId);
    if (current == null || current.isTerminal()) {
      // Cancelled or finished while the request was outstanding.
      clearActiveJob(jobId);
      return ReconcileOutcome.Disposition.FINALIZED;
    }
    if (error != null) {
      log.warn(
          "Could not reach the automation service for job {}, resuming polling: {}",
          jobId,
          ExceptionUtil.extractErrorMessage(error));
      return resumePolling(current);
    }

    JobRecord next = applyStatus(jobId, status);
    if (next != null && next.isTerminal()) {
      registry.stopPolling(jobId);
      clearActiveJob(jobId);
      log.info("Job {} finished while detached: {}", jobId, next.status());
      return ReconcileOutcome.Disposition.FINALIZED;
    }
    return resumePolling(next == null ? current : next);
  }

  private ReconcileOutcome.Disposition resumePolling(JobRecord record) {
    if (record.isPaused()) {
      log.info("Job {} stays paused: {}", record.jobId(), record.pauseReason());
      return ReconcileOutcome.Disposition.HELD;
    }
    registry.startPolling(record.jobId(), new RecordUpdater(record.jobId()), record.context());
    return ReconcileOutcome.Disposition.RESUMED;
  }

  /** Load persisted records this process does not know yet, jobs that never started included. */
  private void restoreRecords(TrackerState state) {
    for (JobSnapshot snapshot : state.jobs()) {
      if (snapshot.context() == null) {
        log.warn("Ignoring persisted job {} without context", snapshot.jobId());
        continue;
      }
      if (snapshot.jobId() != null) {
        records.putIfAbsent(snapshot.jobId(), JobRecord.fromSnapshot(snapshot));
      } else if (rejected.stream().noneMatch(r -> r.toSnapshot().equals(snapshot))) {
        rejected.add(JobRecord.fromSnapshot(snapshot));
      }
    }
  }

  private TrackerState pruneStale() {
    Instant now = scheduler.now();
    TrackerState state = repository.pruneStale(retention, now);
    Instant cutoff = now.minus(retention);
    int dropped = dropRecords(job -> TrackerState.isStale(job, cutoff));
    if (dropped > 0) {
      log.debug("Dropped {} stale job records from memory", dropped);
    }
    return state;
  }

  private int dropRecords(Predicate<JobSnapshot> filter) {
    int before = records.size() + rejected.size();
    records.values().removeIf(record -> filter.test(record.toSnapshot()));
    rejected.removeIf(record -> filter.test(record.toSnapshot()));
    return before - records.size() - rejected.size();
  }

  private static StateException finished(JobRecord record) {
    return new StateException(
        "Job %s is already %s".formatted(record.jobId(), record.status().wireValue()));
  }

  private JobRecord applyStatus(String jobId, AutomationStatus status) {
    JobRecord current = records.get(jobId);
    if (current == null) {
      return null;
    }
    JobRecord next =
        current.apply(status.status(), status.message(), status.visits(), scheduler.now());
    if (next == current) {
      return next;
    }
    records.put(jobId, next);
    if (!next.sameContentAs(current) || next.statusChanged()) {
      repository.update(state -> state.withJob(next.toSnapshot()));
    }
    notifyListeners(next);
    return next;
  }

  private void clearActiveJob(String jobId) {
    repository.update(
        state -> jobId.equals(state.activeJobId()) ? state.clearActiveJob() : state);
  }

  private void notifyListeners(JobRecord record) {
    for (JobUpdateListener listener : listeners) {
      try {
        listener.onJobChanged(record);
      } catch (RuntimeException e) {
        log.error("Job update listener failed for job {}", record.jobId(), e);
      }
    }
  }

  private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> request) {
    try {
      return request.get();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /** Feeds poll results of one job into its record. */
  private final class RecordUpdater implements JobListener {
    private final String jobId;

    RecordUpdater(String jobId) {
      this.jobId = jobId;
    }

    @Override
    public void onUpdate(AutomationStatus status) {
      applyStatus(jobId, status);
    }

    @Override
    public void onComplete() {
      clearActiveJob(jobId);
    }

    @Override
    public void onError(TrackerException error) {
      clearActiveJob(jobId);
    }
  }
}

package com.fieldflow.tracker.store;

import com.fieldflow.tracker.jobs.JobSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Everything the tracker persists, written as one value so that the active job id, the polling
 * flag and the job records always change together.
 *
 * @param version incremented on every successful update
 * @param activeJobId job that was being tracked when the state was written, or null
 * @param polling whether {@code activeJobId} was still being polled
 * @param jobs persisted job records, oldest first
 * @param lastStatusUpdateTimestamp time of the last applied remote status observation
 */
public record TrackerState(
    long version,
    String activeJobId,
    boolean polling,
    List<JobSnapshot> jobs,
    Instant lastStatusUpdateTimestamp) {

  public TrackerState {
    jobs = jobs == null ? List.of() : List.copyOf(jobs);
  }

  public static TrackerState empty() {
    return new TrackerState(0, null, false, List.of(), null);
  }

  /** True when a job was left outstanding by the previous process. */
  public boolean hasOutstandingJob() {
    return !outstandingJobIds().isEmpty();
  }

  /**
   * Ids of every job that was not finished when the state was written: all non-terminal snapshots
   * with an id, plus the polled {@code activeJobId}. Several jobs can be in flight at once, so the
   * active slot alone is not enough.
   */
  public List<String> outstandingJobIds() {
    Set<String> ids = new LinkedHashSet<>();
    for (JobSnapshot job : jobs) {
      if (job.jobId() != null && !job.isTerminal()) {
        ids.add(job.jobId());
      }
    }
    if (polling && activeJobId != null && !activeJobId.isBlank()) {
      ids.add(activeJobId);
    }
    return List.copyOf(ids);
  }

  public Optional<JobSnapshot> job(String jobId) {
    return jobs.stream().filter(j -> Objects.equals(j.jobId(), jobId)).findFirst();
  }

  public TrackerState withVersion(long nextVersion) {
    return new TrackerState(nextVersion, activeJobId, polling, jobs, lastStatusUpdateTimestamp);
  }

  public TrackerState withActiveJob(String jobId, boolean isPolling) {
    return new TrackerState(version, jobId, isPolling, jobs, lastStatusUpdateTimestamp);
  }

  public TrackerState clearActiveJob() {
    return withActiveJob(null, false);
  }

  /**
   * Insert or replace the snapshot with the same job id. Snapshots without an id (jobs that never
   * started) are appended.
   */
  public TrackerState withJob(JobSnapshot snapshot) {
    List<JobSnapshot> next = new ArrayList<>(jobs);
    boolean replaced = false;
    if (snapshot.jobId() != null) {
      for (int i = 0; i < next.size(); i++) {
        if (snapshot.jobId().equals(next.get(i).jobId())) {
          next.set(i, snapshot);
          replaced = true;
          break;
        }
      }
    }
    if (!replaced) {
      next.add(snapshot);
    }
    Instant lastUpdate = lastStatusUpdateTimestamp;
    if (snapshot.lastUpdateTime() != null
        && (lastUpdate == null || snapshot.lastUpdateTime().isAfter(lastUpdate))) {
      lastUpdate = snapshot.lastUpdateTime();
    }
    return new TrackerState(version, activeJobId, polling, next, lastUpdate);
  }

  /** Drop every snapshot matching {@code filter}. Returns {@code this} when nothing matched. */
  public TrackerState withoutJobs(Predicate<JobSnapshot> filter) {
    List<JobSnapshot> kept = jobs.stream().filter(filter.negate()).toList();
    if (kept.size() == jobs.size()) {
      return this;
    }
    return new TrackerState(version, activeJobId, polling, kept, lastStatusUpdateTimestamp);
  }

  /**
   * Drop records whose last activity is older than {@code retention}. Records that are not
   * terminal ({@code running}, paused or still starting) are always kept.
   */
  public TrackerState pruneStale(Duration retention, Instant now) {
    Instant cutoff = now.minus(retention);
    return withoutJobs(job -> isStale(job, cutoff));
  }

  /** A terminal snapshot whose last activity is before {@code cutoff}. */
  public static boolean isStale(JobSnapshot job, Instant cutoff) {
    return job.isTerminal() && lastActivity(job).isBefore(cutoff);
  }

  private static Instant lastActivity(JobSnapshot job) {
    Instant latest = job.startTime() == null ? Instant.EPOCH : job.startTime();
    if (job.lastUpdateTime() != null && job.lastUpdateTime().isAfter(latest)) {
      latest = job.lastUpdateTime();
    }
    if (job.endTime() != null && job.endTime().isAfter(latest)) {
      latest = job.endTime();
    }
    return latest;
  }
}

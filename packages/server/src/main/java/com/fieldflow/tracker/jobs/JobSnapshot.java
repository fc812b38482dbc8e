package com.fieldflow.tracker.jobs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

/** Persisted projection of a {@link JobRecord}, without the transient update flags. */
public record JobSnapshot(
    String jobId,
    JobStatus status,
    String message,
    Instant startTime,
    Instant endTime,
    Instant lastUpdateTime,
    JobContext context,
    VisitCounts visits,
    String pauseReason) {

  @JsonIgnore
  public boolean isTerminal() {
    return status != null && status.isTerminal();
  }
}

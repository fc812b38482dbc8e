package com.fieldflow.tracker.remote;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fieldflow.tracker.jobs.JobStatus;
import com.fieldflow.tracker.jobs.VisitCounts;

/**
 * Body of {@code GET unified-status/{jobId}} and {@code GET batch/{jobId}/status}. The service
 * sends many more fields (dispenser progress, current visit); only the ones the tracker relies on
 * are mapped. Visit counters are only present for batch jobs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AutomationStatus(
    JobStatus status,
    String message,
    String jobId,
    Integer completedVisits,
    Integer totalVisits) {

  public AutomationStatus {
    status = status == null ? JobStatus.IDLE : status;
  }

  public static AutomationStatus of(JobStatus status, String message) {
    return new AutomationStatus(status, message, null, null, null);
  }

  public static AutomationStatus ofBatch(
      JobStatus status, String message, int completedVisits, int totalVisits) {
    return new AutomationStatus(status, message, null, completedVisits, totalVisits);
  }

  /** Visit counters, or null when the report carries none. */
  @JsonIgnore
  public VisitCounts visits() {
    return VisitCounts.of(completedVisits, totalVisits);
  }
}

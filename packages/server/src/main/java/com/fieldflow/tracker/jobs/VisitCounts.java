package com.fieldflow.tracker.jobs;

/**
 * Visit counters reported for a batch job.
 *
 * @param completed visits finished so far
 * @param total visits in the batch
 */
public record VisitCounts(int completed, int total) {

  public VisitCounts {
    total = Math.max(0, total);
    completed = Math.max(0, Math.min(completed, total));
  }

  /** Counters from a status report, or null when the report carries no usable total. */
  public static VisitCounts of(Integer completed, Integer total) {
    if (total == null || total <= 0) {
      return null;
    }
    return new VisitCounts(completed == null ? 0 : completed, total);
  }
}

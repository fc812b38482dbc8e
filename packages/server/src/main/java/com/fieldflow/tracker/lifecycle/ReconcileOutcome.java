package com.fieldflow.tracker.lifecycle;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * What {@link LifecycleController#reconcileOnResume()} did with each job the previous process
 * left outstanding.
 *
 * @param resumed still running remotely, or status unknown; polling was resumed
 * @param finalized already finished remotely, or no longer known; no timer was started
 * @param held paused by the user; left paused until resumed
 */
public record ReconcileOutcome(List<String> resumed, List<String> finalized, List<String> held) {

  /** Per-job result of reconciliation. */
  public enum Disposition {
    RESUMED,
    FINALIZED,
    HELD
  }

  public ReconcileOutcome {
    resumed = List.copyOf(resumed);
    finalized = List.copyOf(finalized);
    held = List.copyOf(held);
  }

  public static ReconcileOutcome nothingOutstanding() {
    return new ReconcileOutcome(List.of(), List.of(), List.of());
  }

  static ReconcileOutcome of(Map<String, Disposition> dispositions) {
    List<String> resumed = new ArrayList<>();
    List<String> finalized = new ArrayList<>();
    List<String> held = new ArrayList<>();
    dispositions.forEach(
        (jobId, disposition) -> {
          switch (disposition) {
            case RESUMED -> resumed.add(jobId);
            case FINALIZED -> finalized.add(jobId);
            case HELD -> held.add(jobId);
          }
        });
    return new ReconcileOutcome(resumed, finalized, held);
  }

  public boolean isNothingOutstanding() {
    return resumed.isEmpty() && finalized.isEmpty() && held.isEmpty();
  }

  @Override
  public String toString() {
    return "resumed=%s finalized=%s held=%s".formatted(resumed, finalized, held);
  }
}

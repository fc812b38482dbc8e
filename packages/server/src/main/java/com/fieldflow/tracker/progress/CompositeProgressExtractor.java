package com.fieldflow.tracker.progress;

import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.jobs.VisitCounts;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Runs a fixed list of adapters in order. */
public final class CompositeProgressExtractor implements ProgressExtractor {
  private final List<ProgressExtractor> adapters;

  public CompositeProgressExtractor(List<ProgressExtractor> adapters) {
    this.adapters = List.copyOf(adapters);
  }

  /** Dispenser counters first, then fuel grade counters, then batch visit counters. */
  public static CompositeProgressExtractor defaults() {
    return new CompositeProgressExtractor(
        List.of(
            new DispenserProgressAdapter(),
            new FuelGradeProgressAdapter(),
            new VisitProgressAdapter()));
  }

  /** First match across all adapters. */
  @Override
  public Optional<Progress> extract(String message, JobContext context) {
    for (ProgressExtractor adapter : adapters) {
      Optional<Progress> progress = adapter.extract(message, context);
      if (progress.isPresent()) {
        return progress;
      }
    }
    return Optional.empty();
  }

  /** Every adapter's match, in adapter order. */
  public List<Progress> extractAll(String message, JobContext context) {
    return extractAll(message, context, null);
  }

  /**
   * Every adapter's match, in adapter order. Visit counters reported by the service replace any
   * visit progress parsed from the message.
   */
  public List<Progress> extractAll(String message, JobContext context, VisitCounts visits) {
    List<Progress> all = new ArrayList<>();
    for (ProgressExtractor adapter : adapters) {
      adapter
          .extract(message, context)
          .filter(progress -> visits == null || progress.stage() != Progress.Stage.VISIT)
          .ifPresent(all::add);
    }
    if (visits != null) {
      all.add(VisitProgressAdapter.fromCounters(visits));
    }
    return all;
  }
}

package com.fieldflow.tracker.management;

import com.fieldflow.tracker.jobs.JobRecord;
import com.fieldflow.tracker.polling.JobRegistry;
import com.fieldflow.tracker.progress.CompositeProgressExtractor;
import com.fieldflow.tracker.scheduling.TaskScheduler;

/** Builds {@link JobView}s with the current polling flags and parsed progress. */
public final class JobViews {
  private final CompositeProgressExtractor extractor;
  private final JobRegistry registry;
  private final TaskScheduler scheduler;

  public JobViews(
      CompositeProgressExtractor extractor, JobRegistry registry, TaskScheduler scheduler) {
    this.extractor = extractor;
    this.registry = registry;
    this.scheduler = scheduler;
  }

  public JobView of(JobRecord record) {
    return JobView.of(record, extractor, registry, scheduler.now());
  }
}

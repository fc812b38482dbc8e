package com.fieldflow.tracker.lifecycle;

import com.fieldflow.tracker.jobs.JobRecord;

/** Notified on the scheduler thread after every change of a {@link JobRecord}. */
@FunctionalInterface
public interface JobUpdateListener {
  void onJobChanged(JobRecord record);
}

package com.fieldflow.tracker.exception;

/** The remote cancel call failed; the local job record was left untouched so it can be retried. */
public class CancellationFailedException extends TrackerException {
  private final String jobId;

  public CancellationFailedException(String jobId, String message, Throwable cause) {
    super(TrackerErrorCode.CANCELLATION_FAILED, message, cause);
    this.jobId = jobId;
    withContext("jobId", jobId);
  }

  public String getJobId() {
    return jobId;
  }
}

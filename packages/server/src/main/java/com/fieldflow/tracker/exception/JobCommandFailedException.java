package com.fieldflow.tracker.exception;

/**
 * The remote service did not acknowledge a pause or resume request; the local job record was left
 * untouched so the command can be retried.
 */
public class JobCommandFailedException extends TrackerException {
  private final String jobId;
  private final String command;

  public JobCommandFailedException(String jobId, String command, String message, Throwable cause) {
    super(TrackerErrorCode.COMMAND_FAILED, message, cause);
    this.jobId = jobId;
    this.command = command;
    withContext("jobId", jobId);
    withContext("command", command);
  }

  public String getJobId() {
    return jobId;
  }

  public String getCommand() {
    return command;
  }
}

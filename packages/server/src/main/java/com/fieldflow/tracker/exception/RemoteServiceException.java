package com.fieldflow.tracker.exception;

/**
 * The remote automation service answered, but rejected the request or reported a failure. Unlike
 * {@link NetworkException} this is surfaced to the user.
 */
public class RemoteServiceException extends TrackerException {
  private final int httpStatus;

  public RemoteServiceException(String message) {
    this(message, 0);
  }

  public RemoteServiceException(String message, int httpStatus) {
    super(TrackerErrorCode.REMOTE_SERVICE_ERROR, message);
    this.httpStatus = httpStatus;
  }

  public RemoteServiceException(String message, Throwable cause) {
    super(TrackerErrorCode.REMOTE_SERVICE_ERROR, message, cause);
    this.httpStatus = 0;
  }

  /** HTTP status of the failed call, or 0 when the failure was reported in a 2xx body. */
  public int getHttpStatus() {
    return httpStatus;
  }
}

package com.fieldflow.tracker.exception;

/** Caller supplied an invalid argument. */
public class ValidationException extends TrackerException {
  public ValidationException(String message) {
    super(TrackerErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(TrackerErrorCode.VALIDATION_ERROR, message, cause);
  }
}

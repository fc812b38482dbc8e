package com.fieldflow.tracker.exception;

/** Component used before initialization or in an illegal state. */
public class StateException extends TrackerException {
  public StateException(String message) {
    super(TrackerErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(TrackerErrorCode.STATE_ERROR, message, cause);
  }
}

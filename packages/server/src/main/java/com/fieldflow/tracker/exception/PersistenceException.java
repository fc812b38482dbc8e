package com.fieldflow.tracker.exception;

/** Failure reading or writing the durable state store. */
public class PersistenceException extends TrackerException {
  public PersistenceException(String message) {
    super(TrackerErrorCode.PERSISTENCE_ERROR, message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(TrackerErrorCode.PERSISTENCE_ERROR, message, cause);
  }
}

package com.fieldflow.tracker.exception;

/** Stable error codes attached to every {@link TrackerException}. */
public enum TrackerErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  VALIDATION_ERROR,
  NETWORK_ERROR,
  REMOTE_SERVICE_ERROR,
  CANCELLATION_FAILED,
  COMMAND_FAILED,
  PERSISTENCE_ERROR
}

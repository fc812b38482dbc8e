package com.fieldflow.tracker.exception;

/** Transport failure while talking to a remote endpoint. Treated as transient by the poller. */
public class NetworkException extends TrackerException {
  public NetworkException(String message) {
    super(TrackerErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(TrackerErrorCode.NETWORK_ERROR, message, cause);
  }
}

package com.fieldflow.tracker.exception;

/** Invalid or missing configuration. */
public class ConfigException extends TrackerException {
  public ConfigException(String message) {
    super(TrackerErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(TrackerErrorCode.CONFIG_ERROR, message, cause);
  }
}

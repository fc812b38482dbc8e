package com.fieldflow.tracker.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception of the tracker. Carries a {@link TrackerErrorCode} and an optional
 * context map that ends up in {@link ErrorDetails}.
 */
public class TrackerException extends RuntimeException {
  private final TrackerErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public TrackerException(TrackerErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public TrackerException(TrackerErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public TrackerErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic key/value pair; returns {@code this} for chaining. */
  public TrackerException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}

package com.fieldflow.tracker.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, serializable description of a failure for logs and API responses. */
public record ErrorDetails(
    String type,
    String message,
    TrackerErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}

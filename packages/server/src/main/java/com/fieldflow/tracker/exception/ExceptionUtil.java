package com.fieldflow.tracker.exception;

import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or API responses. If the
   * throwable is a {@link TrackerException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    Throwable cause = unwrap(t);
    if (cause instanceof TrackerException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        cause.getClass().getSimpleName(),
        safeMessage(cause.getMessage()),
        TrackerErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Strip the wrappers added by {@link java.util.concurrent.CompletableFuture} so callers see the
   * exception that actually failed the stage.
   */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Extract a user-facing message from a throwable. Remote-service failures are returned verbatim,
   * anything else is prefixed with its simple class name.
   *
   * @param t the throwable to extract the message from
   * @return the error message, or a default message if none is available
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    Throwable cause = unwrap(t);

    // Messages reported by the automation service are already meant for the user.
    Throwable current = cause;
    while (current != null) {
      if (current instanceof RemoteServiceException && !isBlank(current.getMessage())) {
        return current.getMessage().trim();
      }
      current = current.getCause();
    }

    if (cause instanceof TrackerException && !isBlank(cause.getMessage())) {
      return cause.getMessage().trim();
    }

    String message = cause.getMessage();
    if (isBlank(message)) {
      return cause.getClass().getSimpleName();
    }
    return cause.getClass().getSimpleName() + ": " + message.trim();
  }

  private static boolean isBlank(String s) {
    return s == null || s.trim().isEmpty();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static TrackerException rethrowIfUnchecked(
      Throwable t, Function<Throwable, TrackerException> supplier) {
    if (t instanceof TrackerException) {
      return (TrackerException) t;
    } else {
      return supplier.apply(t);
    }
  }
}

package com.fieldflow.tracker.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void unwrapStripsFutureWrappers() {
    NetworkException root = new NetworkException("connection refused");
    Throwable wrapped = new CompletionException(new ExecutionException(root));

    assertSame(root, ExceptionUtil.unwrap(wrapped));
  }

  @Test
  void remoteMessagesAreReturnedVerbatim() {
    RemoteServiceException remote = new RemoteServiceException("  Visit URL is invalid ", 400);

    assertEquals(
        "Visit URL is invalid",
        ExceptionUtil.extractErrorMessage(new CompletionException(remote)));
    assertEquals(
        "Visit URL is invalid",
        ExceptionUtil.extractErrorMessage(new NetworkException("wrapped", remote)));
  }

  @Test
  void otherFailuresArePrefixedWithTheirType() {
    assertEquals(
        "IllegalStateException: boom",
        ExceptionUtil.extractErrorMessage(new IllegalStateException("boom")));
    assertEquals(
        "NullPointerException", ExceptionUtil.extractErrorMessage(new NullPointerException()));
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
  }

  @Test
  void errorDetailsKeepCodeAndContext() {
    CancellationFailedException e = new CancellationFailedException("J1", "refused", null);

    ErrorDetails details = ExceptionUtil.toErrorDetails(new CompletionException(e));

    assertEquals(TrackerErrorCode.CANCELLATION_FAILED, details.code());
    assertEquals("CancellationFailedException", details.type());
    assertEquals("J1", details.context().get("jobId"));
  }

  @Test
  void errorDetailsOfForeignExceptionsAreUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalArgumentException("bad"));

    assertEquals(TrackerErrorCode.UNKNOWN, details.code());
    assertEquals("bad", details.message());
  }
}

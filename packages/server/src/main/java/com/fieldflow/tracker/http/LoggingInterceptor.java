package com.fieldflow.tracker.http;

import com.fieldflow.tracker.logging.LoggingService;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/**
 * Logs every outgoing call to the automation service. Status polls run every second, so the
 * happy path is logged at debug/trace level only; transport failures are logged at warn and
 * rethrown unchanged.
 */
public class LoggingInterceptor implements Interceptor {
  private static final Logger log = LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug("Sending {} {}", request.method(), request.url());
    if (log.isTraceEnabled()) {
      log.trace("Request body:\n{}", bodyToString(request));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsedMs(startTime));
      throw e;
    } catch (ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    log.debug(
        "Received {} for {} {} in {} ms",
        response.code(),
        request.method(),
        request.url(),
        elapsedMs(startTime));
    if (log.isTraceEnabled()) {
      try {
        ResponseBody peeked = response.peekBody(64 * 1024);
        log.trace("Response body:\n{}", peeked.string());
      } catch (IOException e) {
        log.trace("Could not read response body", e);
      }
    }
    return response;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}

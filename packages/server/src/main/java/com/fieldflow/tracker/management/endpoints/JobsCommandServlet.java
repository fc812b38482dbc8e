package com.fieldflow.tracker.management.endpoints;

import com.fieldflow.tracker.exception.CancellationFailedException;
import com.fieldflow.tracker.exception.ExceptionUtil;
import com.fieldflow.tracker.exception.JobCommandFailedException;
import com.fieldflow.tracker.exception.StateException;
import com.fieldflow.tracker.exception.ValidationException;
import com.fieldflow.tracker.jobs.JobRecord;
import com.fieldflow.tracker.lifecycle.LifecycleController;
import com.fieldflow.tracker.management.JobViews;
import com.fieldflow.tracker.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Commands on one job:
 *
 * <ul>
 *   <li>{@code DELETE /api/jobs/{jobId}} asks the automation service to stop the job
 *   <li>{@code POST /api/jobs/{jobId}/pause} with an optional {@code {"reason": ...}} body
 *   <li>{@code POST /api/jobs/{jobId}/resume}
 * </ul>
 *
 * A refused command answers 502, a finished or running job that cannot take the command 409.
 */
public final class JobsCommandServlet extends HttpServlet {
  private final LifecycleController controller;
  private final JobViews views;
  private final Duration requestTimeout;

  public JobsCommandServlet(
      LifecycleController controller, JobViews views, Duration requestTimeout) {
    this.controller = controller;
    this.views = views;
    this.requestTimeout = requestTimeout;
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String jobId = JsonResponses.jobId(req.getPathInfo());
    if (jobId == null) {
      resp.sendError(400, "Missing jobId");
      return;
    }
    run(jobId, () -> controller.cancel(jobId), resp);
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String[] segments = StringUtils.split(StringUtils.defaultString(req.getPathInfo()), '/');
    if (segments.length != 2) {
      resp.sendError(404, "Unknown command");
      return;
    }
    String jobId = segments[0];
    switch (segments[1]) {
      case "pause" -> {
        String reason;
        try {
          reason = reason(req);
        } catch (ValidationException e) {
          JsonResponses.error(resp, 400, e);
          return;
        }
        run(jobId, () -> controller.pause(jobId, reason), resp);
      }
      case "resume" -> run(jobId, () -> controller.resume(jobId), resp);
      default -> resp.sendError(404, "Unknown command");
    }
  }

  private void run(
      String jobId,
      Supplier<CompletableFuture<JobRecord>> command,
      HttpServletResponse resp)
      throws IOException {
    if (controller.record(jobId).isEmpty()) {
      resp.sendError(404, "Unknown jobId");
      return;
    }

    try {
      JobRecord record = command.get().get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (record == null) {
        resp.sendError(404, "Unknown jobId");
        return;
      }
      JsonResponses.write(resp, 200, views.of(record));
    } catch (ExecutionException e) {
      Throwable cause = ExceptionUtil.unwrap(e);
      JsonResponses.error(resp, statusOf(cause), cause);
    } catch (TimeoutException e) {
      resp.sendError(504, "Automation service did not answer in time");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      resp.sendError(503, "Interrupted");
    }
  }

  private static int statusOf(Throwable cause) {
    if (cause instanceof CancellationFailedException
        || cause instanceof JobCommandFailedException) {
      return 502;
    }
    if (cause instanceof StateException) {
      return 409;
    }
    if (cause instanceof ValidationException) {
      return 400;
    }
    return 500;
  }

  private static String reason(HttpServletRequest req) throws IOException {
    String body = req.getReader().lines().collect(Collectors.joining("\n"));
    if (StringUtils.isBlank(body)) {
      return null;
    }
    try {
      var node = JacksonUtility.getJsonMapper().readTree(body);
      return node.hasNonNull("reason") ? node.get("reason").asText() : null;
    } catch (IOException e) {
      throw new ValidationException("Malformed request body", e);
    }
  }
}

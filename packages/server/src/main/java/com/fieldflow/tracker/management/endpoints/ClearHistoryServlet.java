package com.fieldflow.tracker.management.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fieldflow.tracker.exception.ExceptionUtil;
import com.fieldflow.tracker.exception.ValidationException;
import com.fieldflow.tracker.jobs.JobKind;
import com.fieldflow.tracker.lifecycle.HistoryCleared;
import com.fieldflow.tracker.lifecycle.LifecycleController;
import com.fieldflow.tracker.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * {@code POST /api/jobs/clear-history} with {@code {"jobType": "single" | "batch" | "all"}} drops
 * finished jobs. A missing body or job type clears every kind.
 */
public final class ClearHistoryServlet extends HttpServlet {
  private final LifecycleController controller;
  private final Duration requestTimeout;

  public ClearHistoryServlet(LifecycleController controller, Duration requestTimeout) {
    this.controller = controller;
    this.requestTimeout = requestTimeout;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    JobKind kind;
    try {
      kind = kind(req.getReader().lines().collect(Collectors.joining("\n")));
    } catch (ValidationException e) {
      JsonResponses.error(resp, 400, e);
      return;
    }

    try {
      HistoryCleared cleared =
          controller.clearHistory(kind).get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
      ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
      node.put("success", true);
      node.put("removed", cleared.removed());
      node.put("remoteAcknowledged", cleared.remoteAcknowledged());
      node.put("message", "Cleared %d finished jobs".formatted(cleared.removed()));
      JsonResponses.write(resp, 200, node);
    } catch (ExecutionException e) {
      JsonResponses.error(resp, 500, ExceptionUtil.unwrap(e));
    } catch (TimeoutException e) {
      resp.sendError(504, "Automation service did not answer in time");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      resp.sendError(503, "Interrupted");
    }
  }

  /** Null stands for every kind. */
  private static JobKind kind(String body) {
    if (StringUtils.isBlank(body)) {
      return null;
    }
    JsonNode node;
    try {
      node = JacksonUtility.getJsonMapper().readTree(body);
    } catch (IOException e) {
      throw new ValidationException("Malformed request body", e);
    }
    String jobType =
        node.hasNonNull("jobType") ? node.get("jobType").asText().toLowerCase(Locale.ROOT) : "all";
    switch (jobType) {
      case "all":
        return null;
      case "single":
        return JobKind.SINGLE;
      case "batch":
        return JobKind.BATCH;
      default:
        throw new ValidationException("jobType must be single, batch or all");
    }
  }
}

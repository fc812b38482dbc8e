package com.fieldflow.tracker.management.endpoints;

import com.fieldflow.tracker.exception.ExceptionUtil;
import com.fieldflow.tracker.exception.ValidationException;
import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.jobs.JobRecord;
import com.fieldflow.tracker.lifecycle.LifecycleController;
import com.fieldflow.tracker.logging.LoggingService;
import com.fieldflow.tracker.management.JobViews;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * POST handler shared by the start endpoints: parses the body into a {@link JobContext}, starts
 * the job and answers 202 with its view, also when the automation service rejected it.
 */
abstract class AbstractStartServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(AbstractStartServlet.class);

  protected final LifecycleController controller;
  protected final JobViews views;
  private final Duration requestTimeout;

  AbstractStartServlet(LifecycleController controller, JobViews views, Duration requestTimeout) {
    this.controller = controller;
    this.views = views;
    this.requestTimeout = requestTimeout;
  }

  /** Parse and validate the request body. */
  protected abstract JobContext parse(String body) throws IOException;

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String body = req.getReader().lines().collect(Collectors.joining("\n"));
    if (StringUtils.isBlank(body)) {
      resp.sendError(400, "Empty request body");
      return;
    }

    JobContext context;
    try {
      context = parse(body);
    } catch (ValidationException e) {
      JsonResponses.error(resp, 400, e);
      return;
    } catch (IOException e) {
      JsonResponses.error(resp, 400, new ValidationException("Malformed request body", e));
      return;
    }

    try {
      JobRecord record =
          controller.start(context).get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
      JsonResponses.write(resp, 202, views.of(record));
    } catch (TimeoutException e) {
      log.warn(
          "Start of {} still pending after {} ms", context.targetUrl(), requestTimeout.toMillis());
      resp.sendError(504, "Automation service did not answer in time");
    } catch (ExecutionException e) {
      JsonResponses.error(resp, 500, ExceptionUtil.unwrap(e));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      resp.sendError(503, "Interrupted");
    }
  }
}

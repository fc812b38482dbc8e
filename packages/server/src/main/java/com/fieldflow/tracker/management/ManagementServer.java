package com.fieldflow.tracker.management;

import com.fieldflow.tracker.http.EmbeddedJettyServer;
import com.fieldflow.tracker.lifecycle.LifecycleController;
import com.fieldflow.tracker.management.endpoints.BatchJobsServlet;
import com.fieldflow.tracker.management.endpoints.ClearHistoryServlet;
import com.fieldflow.tracker.management.endpoints.JobsCommandServlet;
import com.fieldflow.tracker.management.endpoints.JobsServlet;
import com.fieldflow.tracker.management.endpoints.JobsStatusServlet;
import java.time.Duration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Registers the job endpoints the dashboard talks to:
 *
 * <ul>
 *   <li>{@code POST /api/jobs} start, {@code GET /api/jobs} list
 *   <li>{@code POST /api/jobs/batch} start a batch job
 *   <li>{@code POST /api/jobs/clear-history} drop finished jobs
 *   <li>{@code GET /api/jobs/status/{jobId}} status with progress
 *   <li>{@code DELETE /api/jobs/{jobId}} cancel
 *   <li>{@code POST /api/jobs/{jobId}/pause}, {@code POST /api/jobs/{jobId}/resume}
 * </ul>
 */
public final class ManagementServer {
  private final EmbeddedJettyServer httpServer;
  private final LifecycleController controller;
  private final JobViews views;
  private final Duration requestTimeout;

  public ManagementServer(
      EmbeddedJettyServer httpServer,
      LifecycleController controller,
      JobViews views,
      Duration requestTimeout) {
    this.httpServer = httpServer;
    this.controller = controller;
    this.views = views;
    this.requestTimeout = requestTimeout;
  }

  private String contextPath() {
    return "/api/jobs";
  }

  /** Register all job servlets with the Jetty context handler. */
  public void register() {
    var ctx = httpServer.getContextHandler();

    ctx.addServlet(
        new ServletHolder(new JobsServlet(controller, views, requestTimeout)), contextPath());
    ctx.addServlet(
        new ServletHolder(new BatchJobsServlet(controller, views, requestTimeout)),
        "%s/batch".formatted(contextPath()));
    ctx.addServlet(
        new ServletHolder(new ClearHistoryServlet(controller, requestTimeout)),
        "%s/clear-history".formatted(contextPath()));
    ctx.addServlet(
        new ServletHolder(new JobsStatusServlet(controller, views)),
        "%s/status/*".formatted(contextPath()));
    ctx.addServlet(
        new ServletHolder(new JobsCommandServlet(controller, views, requestTimeout)),
        "%s/*".formatted(contextPath()));
  }
}

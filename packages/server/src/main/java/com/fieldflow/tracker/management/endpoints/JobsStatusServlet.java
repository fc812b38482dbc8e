package com.fieldflow.tracker.management.endpoints;

import com.fieldflow.tracker.lifecycle.LifecycleController;
import com.fieldflow.tracker.management.JobViews;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /api/jobs/status/{jobId} returns the current view of one job with parsed progress. */
public final class JobsStatusServlet extends HttpServlet {
  private final LifecycleController controller;
  private final JobViews views;

  public JobsStatusServlet(LifecycleController controller, JobViews views) {
    this.controller = controller;
    this.views = views;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String jobId = JsonResponses.jobId(req.getPathInfo());
    if (jobId == null) {
      resp.sendError(400, "Missing jobId");
      return;
    }

    var record = controller.record(jobId);
    if (record.isEmpty()) {
      resp.sendError(404, "Unknown jobId");
      return;
    }
    JsonResponses.write(resp, 200, views.of(record.get()));
  }
}

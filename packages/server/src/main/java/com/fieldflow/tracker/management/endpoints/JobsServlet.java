package com.fieldflow.tracker.management.endpoints;

import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.jobs.JobKind;
import com.fieldflow.tracker.lifecycle.LifecycleController;
import com.fieldflow.tracker.management.JobStartRequest;
import com.fieldflow.tracker.management.JobViews;
import com.fieldflow.tracker.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import org.apache.commons.lang3.StringUtils;

/**
 * {@code POST /api/jobs} starts a single-visit job and answers 202 with its view; {@code GET
 * /api/jobs} lists every known job, or only those of {@code ?kind=single|batch}.
 */
public final class JobsServlet extends AbstractStartServlet {

  public JobsServlet(LifecycleController controller, JobViews views, Duration requestTimeout) {
    super(controller, views, requestTimeout);
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String kind = StringUtils.trimToNull(req.getParameter("kind"));
    JobKind filter = kind == null ? null : JobKind.fromWire(kind);
    if (filter != null && !filter.wireValue().equalsIgnoreCase(kind)) {
      resp.sendError(400, "kind must be single or batch");
      return;
    }
    JsonResponses.write(
        resp,
        200,
        controller.records().stream()
            .filter(record -> filter == null || record.kind() == filter)
            .map(views::of)
            .toList());
  }

  @Override
  protected JobContext parse(String body) throws IOException {
    return JacksonUtility.getJsonMapper().readValue(body, JobStartRequest.class).toContext();
  }
}

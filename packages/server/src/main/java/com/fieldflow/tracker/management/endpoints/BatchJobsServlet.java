package com.fieldflow.tracker.management.endpoints;

import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.lifecycle.LifecycleController;
import com.fieldflow.tracker.management.BatchStartRequest;
import com.fieldflow.tracker.management.JobViews;
import com.fieldflow.tracker.utility.JacksonUtility;
import java.io.IOException;
import java.time.Duration;

/** {@code POST /api/jobs/batch} starts a batch job over a visit list and answers 202. */
public final class BatchJobsServlet extends AbstractStartServlet {

  public BatchJobsServlet(
      LifecycleController controller, JobViews views, Duration requestTimeout) {
    super(controller, views, requestTimeout);
  }

  @Override
  protected JobContext parse(String body) throws IOException {
    return JacksonUtility.getJsonMapper().readValue(body, BatchStartRequest.class).toContext();
  }
}

package com.fieldflow.tracker.management.endpoints;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.jobs.JobKind;
import com.fieldflow.tracker.jobs.JobRecord;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class BatchJobsServletTest {
  private ServletFixture fx;
  private BatchJobsServlet servlet;

  @BeforeEach
  void setUp() throws Exception {
    fx = new ServletFixture();
    servlet = new BatchJobsServlet(fx.controller, fx.views, Duration.ofMillis(200));
  }

  @Test
  void startsABatchOverTheSelectedVisits() throws Exception {
    JobContext batch =
        JobContext.batch("/data/visits-may.xlsx", false, List.of("V-1", "V-7"), Map.of());
    JobRecord running = JobRecord.pending(batch, fx.scheduler.now()).started("B1", null);
    when(fx.controller.start(any())).thenReturn(CompletableFuture.completedFuture(running));
    fx.body(
        "{\"filePath\":\"/data/visits-may.xlsx\",\"headless\":false,"
            + "\"selectedVisits\":[\"V-1\",\"V-7\"],\"resumeFromJobId\":\"B0\"}");

    servlet.doPost(fx.request, fx.response);

    ArgumentCaptor<JobContext> context = ArgumentCaptor.forClass(JobContext.class);
    verify(fx.controller).start(context.capture());
    assertEquals(JobKind.BATCH, context.getValue().kind());
    assertEquals("/data/visits-may.xlsx", context.getValue().targetUrl());
    assertFalse(context.getValue().headless());
    assertEquals(List.of("V-1", "V-7"), context.getValue().selectedVisits());
    assertEquals("B0", context.getValue().options().get(JobContext.RESUME_FROM_BATCH_OPTION));

    verify(fx.response).setStatus(202);
    JsonNode json = fx.json();
    assertEquals("B1", json.get("jobId").asText());
    assertEquals("batch", json.get("kind").asText());
  }

  @Test
  void missingFilePathIsAValidationError() throws Exception {
    fx.body("{\"selectedVisits\":[\"V-1\"]}");

    servlet.doPost(fx.request, fx.response);

    verify(fx.response).setStatus(400);
    assertEquals("filePath is required", fx.json().get("error").asText());
    verify(fx.controller, never()).start(any());
  }

  @Test
  void blankVisitIdsAreRejected() throws Exception {
    fx.body("{\"filePath\":\"/data/visits.xlsx\",\"selectedVisits\":[\"V-1\",\" \"]}");

    servlet.doPost(fx.request, fx.response);

    verify(fx.response).setStatus(400);
    assertEquals("selectedVisits must not contain blank ids", fx.json().get("error").asText());
  }
}

package com.fieldflow.tracker.management.endpoints;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.jobs.JobRecord;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class JobsServletTest {
  private ServletFixture fx;
  private JobsServlet servlet;

  @BeforeEach
  void setUp() throws Exception {
    fx = new ServletFixture();
    servlet = new JobsServlet(fx.controller, fx.views, Duration.ofMillis(200));
  }

  @Test
  @DisplayName("POST starts a job and answers 202 with its view")
  void startAccepted() throws Exception {
    JobRecord running = fx.runningJob("J1", "Starting automation");
    when(fx.controller.start(any())).thenReturn(CompletableFuture.completedFuture(running));
    fx.body(
        "{\"targetUrl\":\"https://app.example.com/work/88/visits/42\","
            + "\"expectedUnits\":3,\"workOrderId\":\"WO-88\"}");

    servlet.doPost(fx.request, fx.response);

    ArgumentCaptor<JobContext> context = ArgumentCaptor.forClass(JobContext.class);
    verify(fx.controller).start(context.capture());
    assertEquals("https://app.example.com/work/88/visits/42", context.getValue().targetUrl());
    assertEquals(3, context.getValue().expectedUnits());
    assertTrue(context.getValue().headless());
    assertEquals("WO-88", context.getValue().workOrderId());

    verify(fx.response).setStatus(202);
    JsonNode json = fx.json();
    assertEquals("J1", json.get("jobId").asText());
    assertEquals("running", json.get("status").asText());
  }

  @Test
  void emptyBodyIsRejected() throws Exception {
    fx.body("");

    servlet.doPost(fx.request, fx.response);

    verify(fx.response).sendError(400, "Empty request body");
    verifyNoInteractions(fx.controller);
  }

  @Test
  void missingTargetIsAValidationError() throws Exception {
    fx.body("{\"expectedUnits\":2}");

    servlet.doPost(fx.request, fx.response);

    verify(fx.response).setStatus(400);
    JsonNode json = fx.json();
    assertEquals("targetUrl is required", json.get("error").asText());
    assertEquals("ValidationException", json.get("type").asText());
    verify(fx.controller, never()).start(any());
  }

  @Test
  void malformedJsonIsAValidationError() throws Exception {
    fx.body("{not json");

    servlet.doPost(fx.request, fx.response);

    verify(fx.response).setStatus(400);
    assertEquals("Malformed request body", fx.json().get("error").asText());
  }

  @Test
  void failedStartIsServerError() throws Exception {
    when(fx.controller.start(any()))
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));
    fx.body("{\"targetUrl\":\"https://app.example.com/v/1\"}");

    servlet.doPost(fx.request, fx.response);

    verify(fx.response).setStatus(500);
    assertEquals("IllegalStateException: boom", fx.json().get("error").asText());
  }

  @Test
  void rejectedStartStillAnswersWithTheErrorRecord() throws Exception {
    JobContext context = JobContext.of("https://app.example.com/v/1", 0);
    JobRecord failed =
        JobRecord.pending(context, fx.scheduler.now())
            .fail("Visit URL is invalid", fx.scheduler.now());
    when(fx.controller.start(any())).thenReturn(CompletableFuture.completedFuture(failed));
    fx.body("{\"targetUrl\":\"https://app.example.com/v/1\"}");

    servlet.doPost(fx.request, fx.response);

    verify(fx.response).setStatus(202);
    JsonNode json = fx.json();
    assertEquals("error", json.get("status").asText());
    assertEquals("Visit URL is invalid", json.get("message").asText());
    assertTrue(json.get("justErrored").asBoolean());
  }

  @Test
  void slowStartTimesOut() throws Exception {
    when(fx.controller.start(any())).thenReturn(new CompletableFuture<>());
    fx.body("{\"targetUrl\":\"https://app.example.com/v/1\"}");

    servlet.doPost(fx.request, fx.response);

    verify(fx.response).sendError(eq(504), anyString());
  }

  @Test
  void listsAllRecords() throws Exception {
    when(fx.controller.records())
        .thenReturn(
            List.of(
                fx.runningJob("J1", "Processing Regular (1/3)"),
                fx.runningJob("J2", "Logging in")));

    servlet.doGet(fx.request, fx.response);

    verify(fx.response).setStatus(200);
    JsonNode json = fx.json();
    assertEquals(2, json.size());
    assertEquals("J1", json.get(0).get("jobId").asText());
    assertEquals("J2", json.get(1).get("jobId").asText());
  }

  @Test
  void listsOnlyTheRequestedKind() throws Exception {
    JobContext batch = JobContext.batch("/data/visits.xlsx", true, List.of(), Map.of());
    when(fx.request.getParameter("kind")).thenReturn("batch");
    when(fx.controller.records())
        .thenReturn(
            List.of(
                fx.runningJob("J1", "Logging in"),
                JobRecord.pending(batch, fx.scheduler.now()).started("B1", null)));

    servlet.doGet(fx.request, fx.response);

    JsonNode json = fx.json();
    assertEquals(1, json.size());
    assertEquals("B1", json.get(0).get("jobId").asText());
  }

  @Test
  void unknownKindIsRejected() throws Exception {
    when(fx.request.getParameter("kind")).thenReturn("weekly");

    servlet.doGet(fx.request, fx.response);

    verify(fx.response).sendError(400, "kind must be single or batch");
  }
}

package com.fieldflow.tracker.management.endpoints;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fieldflow.tracker.jobs.JobKind;
import com.fieldflow.tracker.lifecycle.HistoryCleared;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClearHistoryServletTest {
  private ServletFixture fx;
  private ClearHistoryServlet servlet;

  @BeforeEach
  void setUp() throws Exception {
    fx = new ServletFixture();
    servlet = new ClearHistoryServlet(fx.controller, Duration.ofMillis(200));
  }

  @Test
  void clearsTheRequestedKind() throws Exception {
    when(fx.controller.clearHistory(JobKind.BATCH))
        .thenReturn(CompletableFuture.completedFuture(new HistoryCleared(3, true)));
    fx.body("{\"jobType\":\"Batch\"}");

    servlet.doPost(fx.request, fx.response);

    verify(fx.response).setStatus(200);
    JsonNode json = fx.json();
    assertTrue(json.get("success").asBoolean());
    assertEquals(3, json.get("removed").asInt());
    assertTrue(json.get("remoteAcknowledged").asBoolean());
    assertEquals("Cleared 3 finished jobs", json.get("message").asText());
  }

  @Test
  void emptyBodyClearsEveryKind() throws Exception {
    when(fx.controller.clearHistory(null))
        .thenReturn(CompletableFuture.completedFuture(new HistoryCleared(0, false)));
    fx.body("");

    servlet.doPost(fx.request, fx.response);

    verify(fx.controller).clearHistory(null);
    assertFalse(fx.json().get("remoteAcknowledged").asBoolean());
  }

  @Test
  void unknownJobTypeIsRejected() throws Exception {
    fx.body("{\"jobType\":\"weekly\"}");

    servlet.doPost(fx.request, fx.response);

    verify(fx.response).setStatus(400);
    assertEquals("jobType must be single, batch or all", fx.json().get("error").asText());
    verify(fx.controller, never()).clearHistory(any());
  }
}

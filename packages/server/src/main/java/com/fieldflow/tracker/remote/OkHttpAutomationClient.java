package com.fieldflow.tracker.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fieldflow.tracker.exception.NetworkException;
import com.fieldflow.tracker.exception.RemoteServiceException;
import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.jobs.JobKind;
import com.fieldflow.tracker.logging.LoggingService;
import com.fieldflow.tracker.utility.JacksonUtility;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/** {@link AutomationClient} speaking JSON over OkHttp. All calls are enqueued, never executed. */
public final class OkHttpAutomationClient implements AutomationClient {
  private static final Logger log = LoggingService.getLogger(OkHttpAutomationClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final AutomationEndpoints endpoints;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public OkHttpAutomationClient(OkHttpClient httpClient, AutomationEndpoints endpoints) {
    this.httpClient = httpClient;
    this.endpoints = endpoints;
  }

  @Override
  public CompletableFuture<StartResponse> start(JobContext context) {
    ObjectNode body = mapper.createObjectNode();
    HttpUrl url;
    if (context.isBatch()) {
      url = endpoints.batchStart();
      body.put("filePath", context.targetUrl());
      body.put("headless", context.headless());
      ArrayNode visits = body.putArray("selectedVisits");
      context.selectedVisits().forEach(visits::add);
    } else {
      url = endpoints.start();
      body.put("visitUrl", context.targetUrl());
      body.put("headless", context.headless());
      if (context.workOrderId() != null) body.put("workOrderId", context.workOrderId());
      if (context.expectedUnits() > 0) body.put("dispenserCount", context.expectedUnits());
    }
    context.options().forEach(body::put);

    Request request =
        new Request.Builder()
            .url(url)
            .post(RequestBody.create(JacksonUtility.toJson(body), JSON))
            .build();
    return send(request, StartResponse.class)
        .thenApply(
            response -> {
              if (!response.accepted()) {
                throw new RemoteServiceException(
                    StringUtils.defaultIfBlank(
                        response.message(), "Automation service did not issue a job id"));
              }
              log.info(
                  "Automation service accepted {} job {}",
                  context.kind().wireValue(),
                  response.jobId());
              return response;
            });
  }

  @Override
  public CompletableFuture<AutomationStatus> status(String jobId, JobKind kind) {
    HttpUrl url = kind == JobKind.BATCH ? endpoints.batchStatus(jobId) : endpoints.status(jobId);
    Request request = new Request.Builder().url(url).get().build();
    return send(request, AutomationStatus.class);
  }

  @Override
  public CompletableFuture<CommandResponse> cancel(String jobId) {
    return command(endpoints.cancel(jobId), "{}", "refused to cancel job " + jobId);
  }

  @Override
  public CompletableFuture<CommandResponse> pause(String jobId, String reason) {
    ObjectNode body = mapper.createObjectNode();
    if (reason != null) body.put("reason", reason);
    return command(
        endpoints.pause(jobId), JacksonUtility.toJson(body), "refused to pause job " + jobId);
  }

  @Override
  public CompletableFuture<CommandResponse> resume(String jobId) {
    return command(endpoints.resume(jobId), "{}", "refused to resume job " + jobId);
  }

  @Override
  public CompletableFuture<CommandResponse> clearHistory(JobKind kind) {
    ObjectNode body = mapper.createObjectNode();
    body.put("userId", endpoints.userId());
    body.put("jobType", kind == null ? "all" : kind.wireValue());
    return command(
        endpoints.clearHistory(), JacksonUtility.toJson(body), "refused to clear job history");
  }

  private CompletableFuture<CommandResponse> command(HttpUrl url, String json, String refusal) {
    Request request = new Request.Builder().url(url).post(RequestBody.create(json, JSON)).build();
    return send(request, CommandResponse.class)
        .thenApply(
            response -> {
              if (!response.success()) {
                throw new RemoteServiceException(
                    StringUtils.defaultIfBlank(
                        response.message(), "Automation service " + refusal));
              }
              return response;
            });
  }

  private <T> CompletableFuture<T> send(Request request, Class<T> type) {
    CompletableFuture<T> future = new CompletableFuture<>();
    HttpUrl url = request.url();
    httpClient
        .newCall(request)
        .enqueue(
            new Callback() {
              @Override
              public void onFailure(@NotNull Call call, @NotNull IOException e) {
                future.completeExceptionally(
                    new NetworkException(
                        "Could not reach automation service at %s: %s"
                            .formatted(url, StringUtils.defaultString(e.getMessage())),
                        e));
              }

              @Override
              public void onResponse(@NotNull Call call, @NotNull Response response) {
                try (ResponseBody body = response.body()) {
                  String text = body == null ? "" : body.string();
                  if (!response.isSuccessful()) {
                    future.completeExceptionally(
                        new RemoteServiceException(errorMessage(text, response), response.code()));
                    return;
                  }
                  future.complete(mapper.readValue(StringUtils.defaultIfBlank(text, "{}"), type));
                } catch (IOException e) {
                  future.completeExceptionally(
                      new NetworkException("Unreadable response from " + url, e));
                } catch (RuntimeException e) {
                  future.completeExceptionally(e);
                }
              }
            });
    return future;
  }

  private String errorMessage(String body, Response response) {
    if (StringUtils.isNotBlank(body)) {
      try {
        JsonNode node = mapper.readTree(body);
        if (node.hasNonNull("error")) return node.get("error").asText();
        if (node.hasNonNull("message")) return node.get("message").asText();
      } catch (IOException e) {
        log.debug("Error body from {} is not JSON", response.request().url());
      }
    }
    return "Automation service responded with HTTP " + response.code();
  }
}

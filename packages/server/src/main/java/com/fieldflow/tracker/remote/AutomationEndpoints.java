package com.fieldflow.tracker.remote;

import com.fieldflow.tracker.exception.ConfigException;
import java.time.Duration;
import okhttp3.HttpUrl;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;

/** Location and timeouts of the automation service, read from the {@code automation} section. */
public record AutomationEndpoints(
    HttpUrl baseUrl,
    String startPath,
    String statusPath,
    String cancelPath,
    String batchStartPath,
    String batchStatusPath,
    String pausePath,
    String resumePath,
    String clearHistoryPath,
    String userId,
    Duration connectTimeout,
    Duration readTimeout) {

  public static final String JOB_ID_PLACEHOLDER = "{jobId}";

  public static AutomationEndpoints fromConfiguration(Configuration configuration) {
    String base = configuration.getString("automation.base-url", "http://localhost:3001");
    HttpUrl baseUrl = HttpUrl.parse(base);
    if (baseUrl == null) {
      throw new ConfigException("Invalid automation.base-url: " + base);
    }
    return new AutomationEndpoints(
        baseUrl,
        configuration.getString("automation.start-path", "/api/form-automation"),
        configuration.getString(
            "automation.status-path", "/api/form-automation/unified-status/{jobId}"),
        configuration.getString("automation.cancel-path", "/api/form-automation/cancel/{jobId}"),
        configuration.getString("automation.batch-start-path", "/api/form-automation/batch"),
        configuration.getString(
            "automation.batch-status-path", "/api/form-automation/batch/{jobId}/status"),
        configuration.getString("automation.pause-path", "/api/form-automation/pause/{jobId}"),
        configuration.getString("automation.resume-path", "/api/form-automation/resume/{jobId}"),
        configuration.getString(
            "automation.clear-history-path", "/api/form-automation/clear-history"),
        configuration.getString("automation.user-id", "fieldflow-tracker"),
        Duration.ofMillis(configuration.getLong("automation.connect-timeout-ms", 5_000L)),
        Duration.ofMillis(configuration.getLong("automation.read-timeout-ms", 10_000L)));
  }

  /** Default paths and timeouts against {@code baseUrl}. */
  public static AutomationEndpoints defaults(String baseUrl) {
    Configuration configuration = new BaseConfiguration();
    configuration.setProperty("automation.base-url", baseUrl);
    return fromConfiguration(configuration);
  }

  HttpUrl start() {
    return resolve(startPath, null);
  }

  HttpUrl status(String jobId) {
    return resolve(statusPath, jobId);
  }

  HttpUrl cancel(String jobId) {
    return resolve(cancelPath, jobId);
  }

  HttpUrl batchStart() {
    return resolve(batchStartPath, null);
  }

  HttpUrl batchStatus(String jobId) {
    return resolve(batchStatusPath, jobId);
  }

  HttpUrl pause(String jobId) {
    return resolve(pausePath, jobId);
  }

  HttpUrl resume(String jobId) {
    return resolve(resumePath, jobId);
  }

  HttpUrl clearHistory() {
    return resolve(clearHistoryPath, null);
  }

  private HttpUrl resolve(String pathTemplate, String jobId) {
    HttpUrl.Builder builder = baseUrl.newBuilder();
    for (String segment : pathTemplate.split("/")) {
      if (segment.isEmpty()) continue;
      builder.addPathSegment(JOB_ID_PLACEHOLDER.equals(segment) ? jobId : segment);
    }
    return builder.build();
  }
}

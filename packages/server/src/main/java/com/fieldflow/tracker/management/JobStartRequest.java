package com.fieldflow.tracker.management;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fieldflow.tracker.exception.ValidationException;
import com.fieldflow.tracker.jobs.JobContext;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/** Body of {@code POST /api/jobs}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobStartRequest(
    String targetUrl,
    Integer expectedUnits,
    Boolean headless,
    String workOrderId,
    Map<String, String> options) {

  public JobContext toContext() {
    if (StringUtils.isBlank(targetUrl)) {
      throw new ValidationException("targetUrl is required");
    }
    if (expectedUnits != null && expectedUnits < 0) {
      throw new ValidationException("expectedUnits must not be negative");
    }
    return new JobContext(
        targetUrl.trim(),
        expectedUnits == null ? 0 : expectedUnits,
        headless == null || headless,
        StringUtils.trimToNull(workOrderId),
        options);
  }
}

package com.fieldflow.tracker.management;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fieldflow.tracker.exception.ValidationException;
import com.fieldflow.tracker.jobs.JobContext;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Body of {@code POST /api/jobs/batch}.
 *
 * @param filePath visit list the automation service reads
 * @param selectedVisits visit ids to process, all when empty
 * @param resumeFromJobId earlier batch job whose finished visits are skipped
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchStartRequest(
    String filePath,
    Boolean headless,
    List<String> selectedVisits,
    String resumeFromJobId,
    Map<String, String> options) {

  public JobContext toContext() {
    if (StringUtils.isBlank(filePath)) {
      throw new ValidationException("filePath is required");
    }
    if (selectedVisits != null && selectedVisits.stream().anyMatch(StringUtils::isBlank)) {
      throw new ValidationException("selectedVisits must not contain blank ids");
    }
    Map<String, String> forwarded = new HashMap<>(options == null ? Map.of() : options);
    if (StringUtils.isNotBlank(resumeFromJobId)) {
      forwarded.put(JobContext.RESUME_FROM_BATCH_OPTION, resumeFromJobId.trim());
    }
    return JobContext.batch(
        filePath.trim(), headless == null || headless, selectedVisits, forwarded);
  }
}

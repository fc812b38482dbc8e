package com.fieldflow.tracker.progress;

import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.jobs.VisitCounts;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Visit counters of batch jobs, e.g. {@code "Processing visit 3 of 12"} or {@code "Visit 3/12"}.
 * Single-visit jobs never report visit progress.
 */
public final class VisitProgressAdapter implements ProgressExtractor {
  private static final Pattern VISIT =
      Pattern.compile("visit\\s*#?(\\d+)\\s*(?:of|/)\\s*(\\d+)", Pattern.CASE_INSENSITIVE);

  @Override
  public Optional<Progress> extract(String message, JobContext context) {
    if (context == null || !context.isBatch() || StringUtils.isBlank(message)) {
      return Optional.empty();
    }
    Matcher m = VISIT.matcher(message);
    if (!m.find()) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          new Progress(
              Progress.Stage.VISIT,
              null,
              Integer.parseInt(m.group(1)),
              Integer.parseInt(m.group(2))));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  /** Progress from the counters of a batch status report. */
  public static Progress fromCounters(VisitCounts visits) {
    return new Progress(Progress.Stage.VISIT, null, visits.completed(), visits.total());
  }
}

package com.fieldflow.tracker.progress;

import com.fieldflow.tracker.jobs.JobContext;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Dispenser counters such as {@code "Dispenser #2 of 4"}. Without an explicit total the expected
 * unit count of the job is used.
 */
public final class DispenserProgressAdapter implements ProgressExtractor {
  private static final Pattern DISPENSER =
      Pattern.compile("dispenser(?:[\\s#]+)(\\d+)(?:[^\\d]+(\\d+)|)", Pattern.CASE_INSENSITIVE);

  @Override
  public Optional<Progress> extract(String message, JobContext context) {
    if (StringUtils.isBlank(message)) {
      return Optional.empty();
    }
    Matcher m = DISPENSER.matcher(message);
    if (!m.find()) {
      return Optional.empty();
    }
    try {
      int current = Integer.parseInt(m.group(1));
      int total =
          m.group(2) != null
              ? Integer.parseInt(m.group(2))
              : context == null ? 0 : context.expectedUnits();
      return Optional.of(new Progress(Progress.Stage.DISPENSER, null, current, total));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}

package com.fieldflow.tracker.progress;

import com.fieldflow.tracker.jobs.JobContext;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Fuel grade counters such as {@code "Fuel grade: Regular (1/3)"}, {@code "Processing Premium
 * (3/3)"} or {@code "Fuel grades (2/4)"}. A bare {@code x/y} counts only when the message mentions
 * fuel.
 */
public final class FuelGradeProgressAdapter implements ProgressExtractor {
  private static final Pattern LABELLED =
      Pattern.compile(
          "fuel\\s+grade:\\s+([a-z\\-\\s]+)\\s*\\((\\d+)/(\\d+)\\)", Pattern.CASE_INSENSITIVE);
  private static final Pattern KNOWN_GRADE =
      Pattern.compile(
          "(regular|premium|unleaded|mid-?grade|diesel|e-?85|kerosene|racing|aviation)"
              + "\\s*\\((\\d+)/(\\d+)\\)",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern GENERAL =
      Pattern.compile("fuel\\s+(?:grades?)?.*?\\((\\d+)/(\\d+)\\)", Pattern.CASE_INSENSITIVE);
  private static final Pattern BARE_COUNTER = Pattern.compile("\\b(\\d+)\\s*/\\s*(\\d+)\\b");

  @Override
  public Optional<Progress> extract(String message, JobContext context) {
    if (StringUtils.isBlank(message)) {
      return Optional.empty();
    }
    for (Pattern pattern : List.of(LABELLED, KNOWN_GRADE)) {
      Matcher m = pattern.matcher(message);
      if (m.find()) {
        return counter(m.group(1).trim(), m.group(2), m.group(3));
      }
    }
    Matcher general = GENERAL.matcher(message);
    if (general.find()) {
      return counter(null, general.group(1), general.group(2));
    }
    if (StringUtils.containsIgnoreCase(message, "fuel")) {
      Matcher bare = BARE_COUNTER.matcher(message);
      if (bare.find()) {
        return counter(null, bare.group(1), bare.group(2));
      }
    }
    return Optional.empty();
  }

  private static Optional<Progress> counter(String label, String current, String total) {
    try {
      return Optional.of(
          new Progress(
              Progress.Stage.FUEL_GRADE,
              label,
              Integer.parseInt(current),
              Integer.parseInt(total)));
    } catch (NumberFormatException e) {
      // Counter too large for an int; treat as no progress.
      return Optional.empty();
    }
  }
}

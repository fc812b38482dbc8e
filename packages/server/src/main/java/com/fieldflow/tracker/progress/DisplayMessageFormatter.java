package com.fieldflow.tracker.progress;

import java.util.Locale;
import java.util.regex.Pattern;

/** Shortens verbose automation messages into stable labels for list views. */
public final class DisplayMessageFormatter {
  private static final Pattern COUNTER = Pattern.compile("\\b\\d+\\s*/\\s*\\d+\\b");

  private DisplayMessageFormatter() {}

  public static String format(String message) {
    if (message == null || message.isEmpty()) {
      return "";
    }
    String lower = message.toLowerCase(Locale.ROOT);
    if (lower.contains("filling form for dispenser")) return "Filling dispenser form...";
    if (lower.contains("filling form")) return "Filling forms...";
    if (lower.contains("working on dispenser")) return "Working on dispensers...";
    if (lower.contains("processing fuel") || lower.contains("fuel grade")) {
      return "Processing fuel...";
    }
    // Messages carrying an x/y counter are already specific enough.
    boolean hasCounter = COUNTER.matcher(message).find();
    if (!hasCounter && (lower.contains("processing") || lower.contains("working on"))) {
      return "Processing...";
    }
    return message;
  }
}

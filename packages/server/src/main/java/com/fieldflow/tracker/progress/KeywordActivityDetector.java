package com.fieldflow.tracker.progress;

import java.util.List;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/** {@link ActivityDetector} matching a small, case-insensitive keyword vocabulary. */
public final class KeywordActivityDetector implements ActivityDetector {
  public static final List<String> DEFAULT_MARKERS =
      List.of(
          "closing browser",
          "filling",
          "entering",
          "processing fuel",
          "fuel grade",
          "navigating",
          "next form");

  private final List<String> markers;

  public KeywordActivityDetector() {
    this(DEFAULT_MARKERS);
  }

  public KeywordActivityDetector(List<String> markers) {
    this.markers =
        markers.stream()
            .filter(StringUtils::isNotBlank)
            .map(m -> m.trim().toLowerCase(Locale.ROOT))
            .toList();
  }

  /** Reads {@code heuristics.activity-markers}; falls back to the default vocabulary. */
  public static KeywordActivityDetector fromConfiguration(Configuration config) {
    List<String> configured = config.getList(String.class, "heuristics.activity-markers", null);
    if (configured == null || configured.isEmpty()) {
      return new KeywordActivityDetector();
    }
    return new KeywordActivityDetector(configured);
  }

  public List<String> markers() {
    return markers;
  }

  @Override
  public boolean isActive(String message) {
    if (StringUtils.isBlank(message)) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    for (String marker : markers) {
      if (lower.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}

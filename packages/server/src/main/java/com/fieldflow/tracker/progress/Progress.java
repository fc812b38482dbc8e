package com.fieldflow.tracker.progress;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured progress parsed from a free-text status message.
 *
 * @param stage which part of the visit the counter refers to
 * @param label optional detail, e.g. the fuel grade being processed; null when unknown
 * @param current 1-based index of the item being processed; for visit counters reported by the
 *     service, the number of visits completed
 * @param total number of items, 0 when unknown
 */
public record Progress(Stage stage, String label, int current, int total) {

  public enum Stage {
    DISPENSER,
    FUEL_GRADE,
    VISIT
  }

  /** Completion percentage clamped to {@code [0, 100]}, or -1 when the total is unknown. */
  @JsonProperty("percent")
  public int percent() {
    if (total <= 0) {
      return -1;
    }
    return Math.max(0, Math.min(100, Math.round(current * 100f / total)));
  }
}

package com.fieldflow.tracker.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle state of an automation job as seen by the tracker. */
public enum JobStatus {
  /** Created locally, remote start not yet confirmed. */
  IDLE("idle"),
  /** Accepted by the remote service and being observed. */
  RUNNING("running"),
  /** Finished, either reported by the remote service or inferred by the heuristics. */
  COMPLETED("completed"),
  /** Failed, rejected at start or stopped by the user. */
  ERROR("error");

  private final String wireValue;

  JobStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }

  /**
   * Normalise a status string reported by the automation service. Legacy aliases are folded into
   * the four tracker states; anything unrecognised carries no status information and maps to
   * {@link #IDLE}.
   */
  @JsonCreator
  public static JobStatus fromWire(String value) {
    if (value == null) {
      return IDLE;
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "running":
      case "processing":
        return RUNNING;
      case "completed":
      case "automation_complete":
        return COMPLETED;
      case "error":
      case "cancelled":
        return ERROR;
      default:
        return IDLE;
    }
  }
}

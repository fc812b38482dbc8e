package com.fieldflow.tracker.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** What a job processes: a single visit, or a list of visits run one after the other. */
public enum JobKind {
  SINGLE("single"),
  BATCH("batch");

  private final String wireValue;

  JobKind(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  /** Null and unrecognised values read as {@link #SINGLE}, the only kind older state files hold. */
  @JsonCreator
  public static JobKind fromWire(String value) {
    if (value != null && BATCH.wireValue.equals(value.trim().toLowerCase(Locale.ROOT))) {
      return BATCH;
    }
    return SINGLE;
  }
}

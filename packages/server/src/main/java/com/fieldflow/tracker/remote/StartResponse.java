package com.fieldflow.tracker.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of the start call. Older service versions omit {@code success} and signal acceptance only
 * through a non-empty {@code jobId}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StartResponse(Boolean success, String message, String jobId) {

  public boolean accepted() {
    return !Boolean.FALSE.equals(success) && jobId != null && !jobId.isBlank();
  }
}

package com.fieldflow.tracker.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Acknowledgement of a cancel, pause, resume or clear-history request. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandResponse(boolean success, String message) {}

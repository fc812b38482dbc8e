package com.fieldflow.tracker.lifecycle;

/**
 * Result of {@link LifecycleController#clearHistory}.
 *
 * @param removed finished job records dropped locally
 * @param remoteAcknowledged whether the automation service confirmed clearing its own history
 */
public record HistoryCleared(int removed, boolean remoteAcknowledged) {}

package com.fieldflow.tracker.polling;

import java.time.Duration;

/**
 * Result of one activity check.
 *
 * @param markerPresent the last message contains an activity keyword
 * @param inactiveFor time since the message last changed or polling last resumed
 * @param recentChange the message changed inside the recent-activity window
 */
public record ActivityAssessment(
    boolean markerPresent, Duration inactiveFor, boolean recentChange) {
  public boolean active() {
    return markerPresent || recentChange;
  }
}

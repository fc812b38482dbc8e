package com.fieldflow.tracker.polling;

import com.fieldflow.tracker.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Timing of the status poller and the completion heuristics.
 *
 * @param interval delay between two status requests for the same job
 * @param informationalDelay one-shot diagnostic log after start
 * @param activityMonitorDelay first activity check after start; recurring checks follow
 * @param activityCheckPeriod period of the recurring activity check
 * @param recentActivityWindow a message changed within this window counts as activity
 * @param inactivityLimit inactivity after which a job is force-completed
 * @param hardCap absolute time after which a job is force-completed
 * @param hardCapRespectsActivity when true the hard cap spares jobs that still look active
 */
public record PollingSettings(
    Duration interval,
    Duration informationalDelay,
    Duration activityMonitorDelay,
    Duration activityCheckPeriod,
    Duration recentActivityWindow,
    Duration inactivityLimit,
    Duration hardCap,
    boolean hardCapRespectsActivity) {

  public PollingSettings {
    requirePositive("polling.interval-ms", interval);
    requirePositive("heuristics.informational-delay-ms", informationalDelay);
    requirePositive("heuristics.activity-monitor-delay-ms", activityMonitorDelay);
    requirePositive("heuristics.activity-check-period-ms", activityCheckPeriod);
    requirePositive("heuristics.recent-activity-window-ms", recentActivityWindow);
    requirePositive("heuristics.inactivity-limit-ms", inactivityLimit);
    requirePositive("heuristics.hard-cap-ms", hardCap);
  }

  public static PollingSettings defaults() {
    return new PollingSettings(
        Duration.ofSeconds(1),
        Duration.ofSeconds(15),
        Duration.ofSeconds(30),
        Duration.ofSeconds(30),
        Duration.ofSeconds(45),
        Duration.ofSeconds(120),
        Duration.ofMinutes(5),
        false);
  }

  public static PollingSettings fromConfiguration(Configuration config) {
    PollingSettings d = defaults();
    return new PollingSettings(
        millis(config, "polling.interval-ms", d.interval()),
        millis(config, "heuristics.informational-delay-ms", d.informationalDelay()),
        millis(config, "heuristics.activity-monitor-delay-ms", d.activityMonitorDelay()),
        millis(config, "heuristics.activity-check-period-ms", d.activityCheckPeriod()),
        millis(config, "heuristics.recent-activity-window-ms", d.recentActivityWindow()),
        millis(config, "heuristics.inactivity-limit-ms", d.inactivityLimit()),
        millis(config, "heuristics.hard-cap-ms", d.hardCap()),
        config.getBoolean("heuristics.hard-cap.respect-activity", d.hardCapRespectsActivity()));
  }

  private static Duration millis(Configuration config, String key, Duration fallback) {
    try {
      return Duration.ofMillis(config.getLong(key, fallback.toMillis()));
    } catch (Exception e) {
      throw new ConfigException("Invalid value for " + key, e);
    }
  }

  private static void requirePositive(String key, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new ConfigException(key + " must be a positive duration, was " + value);
    }
  }
}

package com.fieldflow.tracker.progress;

/** Decides whether a status message shows the remote automation doing real work. */
@FunctionalInterface
public interface ActivityDetector {
  boolean isActive(String message);
}

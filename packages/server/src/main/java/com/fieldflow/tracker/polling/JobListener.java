package com.fieldflow.tracker.polling;

import com.fieldflow.tracker.exception.TrackerException;
import com.fieldflow.tracker.remote.AutomationStatus;

/**
 * Callbacks bound to one polled job. All methods run on the scheduler thread.
 *
 * <p>{@link #onUpdate} fires after every successful poll. Exactly one of {@link #onComplete} or
 * {@link #onError} fires once the job ends, right after the final {@code onUpdate}; nothing fires
 * afterwards.
 */
public interface JobListener {
  void onUpdate(AutomationStatus status);

  void onComplete();

  void onError(TrackerException error);
}

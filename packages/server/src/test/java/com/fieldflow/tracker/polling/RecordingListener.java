package com.fieldflow.tracker.polling;

import com.fieldflow.tracker.exception.TrackerException;
import com.fieldflow.tracker.remote.AutomationStatus;
import java.util.ArrayList;
import java.util.List;

/** Records every callback, in order. */
class RecordingListener implements JobListener {
  final List<AutomationStatus> updates = new ArrayList<>();
  final List<TrackerException> errors = new ArrayList<>();
  final List<String> events = new ArrayList<>();
  int completions;

  @Override
  public void onUpdate(AutomationStatus status) {
    updates.add(status);
    events.add("update:" + status.status().wireValue());
  }

  @Override
  public void onComplete() {
    completions++;
    events.add("complete");
  }

  @Override
  public void onError(TrackerException error) {
    errors.add(error);
    events.add("error");
  }

  AutomationStatus lastUpdate() {
    return updates.get(updates.size() - 1);
  }
}

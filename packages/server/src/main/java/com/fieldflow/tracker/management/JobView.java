package com.fieldflow.tracker.management;

import com.fieldflow.tracker.jobs.JobKind;
import com.fieldflow.tracker.jobs.JobRecord;
import com.fieldflow.tracker.jobs.JobStatus;
import com.fieldflow.tracker.polling.JobRegistry;
import com.fieldflow.tracker.progress.CompositeProgressExtractor;
import com.fieldflow.tracker.progress.DisplayMessageFormatter;
import com.fieldflow.tracker.progress.Progress;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * JSON shape of a job as returned by the management endpoints. For batch jobs {@code targetUrl}
 * holds the visit list file and {@code progress} carries the visit counters.
 */
public record JobView(
    String jobId,
    JobKind kind,
    JobStatus status,
    String message,
    String displayMessage,
    String targetUrl,
    int expectedUnits,
    String workOrderId,
    Instant startTime,
    Instant endTime,
    Instant lastUpdateTime,
    long elapsedSeconds,
    boolean polling,
    boolean paused,
    String pauseReason,
    boolean statusChanged,
    boolean justCompleted,
    boolean justErrored,
    List<Progress> progress) {

  public static JobView of(
      JobRecord record,
      CompositeProgressExtractor extractor,
      JobRegistry registry,
      Instant now) {
    Instant end = record.endTime() != null ? record.endTime() : now;
    long elapsed = Math.max(0, Duration.between(record.startTime(), end).toSeconds());
    return new JobView(
        record.jobId(),
        record.kind(),
        record.status(),
        record.message(),
        DisplayMessageFormatter.format(record.message()),
        record.context().targetUrl(),
        record.context().expectedUnits(),
        record.context().workOrderId(),
        record.startTime(),
        record.endTime(),
        record.lastUpdateTime(),
        elapsed,
        registry.isPolling(record.jobId()),
        record.isPaused() || registry.isPaused(record.jobId()),
        record.pauseReason(),
        record.statusChanged(),
        record.justCompleted(),
        record.justErrored(),
        extractor.extractAll(record.message(), record.context(), record.visits()));
  }
}

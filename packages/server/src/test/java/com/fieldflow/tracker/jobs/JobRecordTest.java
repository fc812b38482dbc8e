package com.fieldflow.tracker.jobs;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class JobRecordTest {
  private static final Instant T0 = Instant.parse("2025-05-01T08:00:00Z");
  private final JobContext context = JobContext.of("https://app.example.com/visits/42", 3);

  private JobRecord running() {
    return JobRecord.pending(context, T0).started("J1", "Automation started");
  }

  @Test
  void pendingRecordIsIdleWithoutId() {
    JobRecord pending = JobRecord.pending(context, T0);
    assertNull(pending.jobId());
    assertEquals(JobStatus.IDLE, pending.status());
    assertEquals("Starting process...", pending.message());
    assertEquals(T0, pending.startTime());
  }

  @Test
  void startMovesToRunning() {
    JobRecord record = running();
    assertEquals("J1", record.jobId());
    assertEquals(JobStatus.RUNNING, record.status());
    assertTrue(record.statusChanged());
    assertNull(record.endTime());
  }

  @Test
  void firstObservationCountsAsStatusChange() {
    JobRecord record =
        running().apply(JobStatus.RUNNING, "Processing Regular (1/3)", T0.plusSeconds(1));

    assertEquals(JobStatus.RUNNING, record.status());
    assertEquals("Processing Regular (1/3)", record.message());
    assertTrue(record.statusChanged());
    assertFalse(record.justCompleted());

    JobRecord second =
        record.apply(JobStatus.RUNNING, "Processing Regular (2/3)", T0.plusSeconds(2));
    assertFalse(second.statusChanged());
    assertEquals(T0.plusSeconds(2), second.lastUpdateTime());
  }

  @Test
  void idleReportNeverMovesBackwards() {
    JobRecord record = running().apply(JobStatus.IDLE, "waiting for browser", T0.plusSeconds(1));
    assertEquals(JobStatus.RUNNING, record.status());
    assertEquals("waiting for browser", record.message());
  }

  @Test
  void completionSetsEndTimeAndDefaultMessage() {
    Instant end = T0.plusSeconds(45);
    JobRecord done = running().apply(JobStatus.COMPLETED, "", end);

    assertEquals(JobStatus.COMPLETED, done.status());
    assertEquals(JobRecord.DEFAULT_COMPLETION_MESSAGE, done.message());
    assertEquals(end, done.endTime());
    assertTrue(done.justCompleted());
    assertTrue(done.statusChanged());
    assertFalse(done.justErrored());
  }

  @Test
  void terminalRecordsIgnoreFurtherUpdates() {
    JobRecord done = running().apply(JobStatus.ERROR, "Login failed", T0.plusSeconds(5));
    assertTrue(done.justErrored());

    JobRecord after = done.apply(JobStatus.RUNNING, "still going", T0.plusSeconds(6));
    assertEquals(JobStatus.ERROR, after.status());
    assertEquals("Login failed", after.message());
    assertEquals(T0.plusSeconds(5), after.endTime());
    assertFalse(after.justErrored());
    assertFalse(after.statusChanged());

    assertEquals(JobStatus.ERROR, done.cancelled(T0.plusSeconds(7)).status());
    assertEquals("Login failed", done.cancelled(T0.plusSeconds(7)).message());
  }

  @Test
  void cancellationIsAnError() {
    JobRecord cancelled = running().cancelled(T0.plusSeconds(10));
    assertEquals(JobStatus.ERROR, cancelled.status());
    assertEquals(JobRecord.STOPPED_BY_USER, cancelled.message());
    assertEquals(T0.plusSeconds(10), cancelled.endTime());
  }

  @Test
  void snapshotRoundTripDropsOnlyTransientFlags() {
    JobRecord record = running().apply(JobStatus.RUNNING, "Filling form", T0.plusSeconds(3));
    JobRecord restored = JobRecord.fromSnapshot(record.toSnapshot());

    assertEquals(record.withoutFlags(), restored);
  }

  @Test
  void pauseIsOrthogonalToStatus() {
    JobRecord paused = running().paused(" ", T0.plusSeconds(4));
    assertEquals(JobStatus.RUNNING, paused.status());
    assertEquals(JobRecord.DEFAULT_PAUSE_REASON, paused.pauseReason());

    JobRecord observed = paused.apply(JobStatus.RUNNING, "Waiting", T0.plusSeconds(5));
    assertTrue(observed.isPaused());

    JobRecord resumed = observed.resumed(T0.plusSeconds(6));
    assertFalse(resumed.isPaused());
    assertEquals("Waiting", resumed.message());
  }

  @Test
  void finishingClearsThePauseReason() {
    JobRecord done =
        running().paused("Lunch break", T0).apply(JobStatus.COMPLETED, "Done", T0.plusSeconds(1));
    assertNull(done.pauseReason());
    assertNull(done.paused("again", T0.plusSeconds(2)).pauseReason());
  }

  @Test
  void missingVisitCountersKeepTheLastOnes() {
    JobContext batch = JobContext.batch("data/visits.json", true, null, null);
    JobRecord record =
        JobRecord.pending(batch, T0)
            .started("B1", null)
            .apply(JobStatus.RUNNING, "Visit 2", new VisitCounts(1, 4), T0.plusSeconds(1))
            .apply(JobStatus.RUNNING, "Visit 2", null, T0.plusSeconds(2));

    assertEquals(new VisitCounts(1, 4), record.visits());
    assertEquals(JobKind.BATCH, record.kind());
    assertTrue(batch.selectedVisits().isEmpty());
  }

  @Test
  void sameContentIgnoresUpdateTime() {
    JobRecord first = running().apply(JobStatus.RUNNING, "Filling form", T0.plusSeconds(1));
    JobRecord second = first.apply(JobStatus.RUNNING, "Filling form", T0.plusSeconds(2));

    assertTrue(second.sameContentAs(first));
    JobRecord third = second.apply(JobStatus.RUNNING, "Next form", T0.plusSeconds(3));
    assertFalse(third.sameContentAs(first));
  }
}

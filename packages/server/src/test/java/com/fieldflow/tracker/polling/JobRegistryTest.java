package com.fieldflow.tracker.polling;

import static org.junit.jupiter.api.Assertions.*;

import com.fieldflow.tracker.jobs.JobContext;
import com.fieldflow.tracker.jobs.JobStatus;
import com.fieldflow.tracker.progress.KeywordActivityDetector;
import com.fieldflow.tracker.remote.FakeAutomationClient;
import com.fieldflow.tracker.scheduling.ManualTaskScheduler;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JobRegistryTest {
  private final JobContext context = JobContext.of("https://app.example.com/visits/7", 2);

  private ManualTaskScheduler scheduler;
  private FakeAutomationClient client;
  private JobRegistry registry;
  private RecordingListener listener;

  @BeforeEach
  void setUp() {
    scheduler = new ManualTaskScheduler();
    client = new FakeAutomationClient().reportStatus(JobStatus.RUNNING, "Logging in");
    registry =
        new JobRegistry(
            scheduler, client, PollingSettings.defaults(), new KeywordActivityDetector());
    listener = new RecordingListener();
  }

  @Test
  @DisplayName("Starting twice while active keeps a single context")
  void startIsIdempotent() {
    assertTrue(registry.startPolling("J1", listener, context));
    assertFalse(registry.startPolling("J1", new RecordingListener(), context));

    scheduler.advanceSeconds(5);

    assertEquals(Set.of("J1"), registry.activeJobIds());
    assertEquals(5, client.statusRequests);
    assertEquals(5, listener.updates.size());
  }

  @Test
  void pauseClearsTimersAndResumeKeepsState() {
    Instant started = scheduler.now();
    registry.startPolling("J1", listener, context);
    scheduler.advanceSeconds(3);

    assertTrue(registry.pausePolling("J1"));
    assertFalse(registry.pausePolling("J1"));
    assertTrue(registry.isPaused("J1"));
    assertFalse(registry.isPolling("J1"));

    int requestsWhilePaused = client.statusRequests;
    scheduler.advanceSeconds(400);
    assertEquals(requestsWhilePaused, client.statusRequests);
    assertEquals(0, listener.completions);

    RecordingListener resumed = new RecordingListener();
    assertTrue(registry.startPolling("J1", resumed, context));
    PollView view = registry.view("J1").orElseThrow();
    assertEquals("Logging in", view.lastMessage());
    assertEquals(started, view.startTime());
    assertEquals(scheduler.now(), view.resumeTime());
    assertFalse(view.paused());

    scheduler.advanceSeconds(2);
    assertEquals(2, resumed.updates.size());
    assertEquals(3, listener.updates.size());
  }

  @Test
  void stopIsSafeToRepeat() {
    registry.startPolling("J1", listener, context);
    scheduler.advanceSeconds(1);

    assertTrue(registry.stopPolling("J1"));
    assertFalse(registry.stopPolling("J1"));
    assertFalse(registry.stopPolling("never-started"));
    assertFalse(registry.stopPolling(null));

    assertEquals(0, scheduler.pendingTasks());
    assertTrue(registry.view("J1").isEmpty());
  }

  @Test
  void concurrentStopsRemoveTheContextOnce() throws Exception {
    registry.startPolling("J1", listener, context);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      CountDownLatch go = new CountDownLatch(1);
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        results.add(
            pool.submit(
                () -> {
                  go.await();
                  return registry.stopPolling("J1");
                }));
      }
      go.countDown();

      int removed = 0;
      for (Future<Boolean> result : results) {
        if (result.get(5, TimeUnit.SECONDS)) removed++;
      }
      assertEquals(1, removed);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void pauseAllAndStopAll() {
    registry.startPolling("J1", listener, context);
    registry.startPolling("J2", new RecordingListener(), context);

    registry.pauseAll();
    assertTrue(registry.isPaused("J1"));
    assertTrue(registry.isPaused("J2"));
    assertEquals(Set.of("J1", "J2"), registry.activeJobIds());

    registry.stopAll();
    assertTrue(registry.activeJobIds().isEmpty());
  }

  @Test
  void blankJobIdIsRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> registry.startPolling(" ", listener, context));
  }
}

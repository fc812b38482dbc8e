package com.fieldflow.tracker.polling;

import java.time.Instant;

/** Read-only copy of a poll context's timing state. */
public record PollView(
    String jobId,
    Instant startTime,
    String lastMessage,
    Instant lastMessageChangeTime,
    Instant lastStatusUpdateTime,
    boolean paused,
    Instant resumeTime,
    boolean requestInFlight) {}

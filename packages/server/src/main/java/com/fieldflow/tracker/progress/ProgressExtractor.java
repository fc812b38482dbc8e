package com.fieldflow.tracker.progress;

import com.fieldflow.tracker.jobs.JobContext;
import java.util.Optional;

/** Parses one known message shape into {@link Progress}. Implementations must not throw. */
public interface ProgressExtractor {
  Optional<Progress> extract(String message, JobContext context);
}

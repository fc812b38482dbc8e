package com.fieldflow.tracker.jobs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of what a job works on. Fixed at creation and used to start the remote
 * task and to interpret its progress messages.
 *
 * @param targetUrl visit URL the automation processes; for batch jobs the visit list file
 * @param expectedUnits number of units (e.g. dispensers) the visit is expected to contain, 0 if
 *     unknown
 * @param headless whether the remote browser should run headless
 * @param workOrderId optional work order reference, may be null
 * @param options additional free-form options forwarded to the remote service
 * @param kind single visit or batch
 * @param selectedVisits batch only: visit ids to process, empty for all
 */
public record JobContext(
    String targetUrl,
    int expectedUnits,
    boolean headless,
    String workOrderId,
    Map<String, String> options,
    JobKind kind,
    List<String> selectedVisits) {

  /** Option carrying the batch job a new batch continues from. */
  public static final String RESUME_FROM_BATCH_OPTION = "resumeFromBatchId";

  public JobContext {
    Objects.requireNonNull(targetUrl, "targetUrl");
    options = options == null ? Map.of() : Map.copyOf(options);
    expectedUnits = Math.max(0, expectedUnits);
    kind = kind == null ? JobKind.SINGLE : kind;
    selectedVisits = selectedVisits == null ? List.of() : List.copyOf(selectedVisits);
  }

  public JobContext(
      String targetUrl,
      int expectedUnits,
      boolean headless,
      String workOrderId,
      Map<String, String> options) {
    this(targetUrl, expectedUnits, headless, workOrderId, options, JobKind.SINGLE, List.of());
  }

  public static JobContext of(String targetUrl, int expectedUnits) {
    return new JobContext(targetUrl, expectedUnits, true, null, Map.of());
  }

  public static JobContext batch(
      String filePath, boolean headless, List<String> selectedVisits, Map<String, String> options) {
    return new JobContext(filePath, 0, headless, null, options, JobKind.BATCH, selectedVisits);
  }

  @JsonIgnore
  public boolean isBatch() {
    return kind == JobKind.BATCH;
  }
}

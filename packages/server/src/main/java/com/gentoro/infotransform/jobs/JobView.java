package com.gentoro.infotransform.jobs;

import java.time.Instant;

/**
 * Immutable snapshot of a job. Two snapshots taken with no result recorded in between are equal.
 */
public record JobView(
    String jobId,
    String batchId,
    JobStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    int totalCount,
    int completedCount,
    int failedCount,
    int skippedCount,
    boolean cancelRequested,
    String message) {

  /** Caller must hold the record's monitor. */
  static JobView of(JobRecord r) {
    return new JobView(
        r.id,
        r.batchId,
        r.status,
        r.createdAt,
        r.startedAt,
        r.finishedAt,
        r.total(),
        r.completed,
        r.failed,
        r.skipped,
        r.cancelRequested,
        r.message);
  }

  /** Files with a terminal result, successful or not. */
  public int processedCount() {
    return completedCount + failedCount + skippedCount;
  }

  public int percent() {
    return totalCount == 0 ? 100 : (int) Math.round(processedCount() * 100.0 / totalCount);
  }
}

package com.gentoro.infotransform.batch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one file. Immutable.
 *
 * <p>{@code terminal=false} marks an intermediate update; every file receives exactly one result
 * with {@code terminal=true}. {@code skipped} marks items dropped because their job was cancelled.
 */
public record BatchResult(
    String jobId,
    String fileId,
    String filename,
    boolean success,
    JsonNode payload,
    String error,
    long processingTimeMs,
    boolean terminal,
    boolean cached,
    boolean skipped) {

  public static BatchResult success(BatchItem item, JsonNode payload, long millis, boolean cached) {
    return new BatchResult(
        item.jobId(), item.fileId(), item.filename(), true, payload, null, millis, true, cached,
        false);
  }

  public static BatchResult partial(BatchItem item, JsonNode payload, long millis) {
    return new BatchResult(
        item.jobId(), item.fileId(), item.filename(), true, payload, null, millis, false, false,
        false);
  }

  public static BatchResult failure(BatchItem item, String error, long millis) {
    return new BatchResult(
        item.jobId(), item.fileId(), item.filename(), false, null, error, millis, true, false,
        false);
  }

  public static BatchResult skipped(BatchItem item) {
    return new BatchResult(
        item.jobId(), item.fileId(), item.filename(), false, null, "Cancelled", 0L, true, false,
        true);
  }
}

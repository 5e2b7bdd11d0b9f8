package com.gentoro.infotransform.batch;

import com.gentoro.infotransform.model.AnalysisContext;

/**
 * One converted (or failed) file travelling from the converter pool to the batch scheduler.
 *
 * <p>Exactly one of {@code markdown} and {@code error} is non-null. Items are consumed once by the
 * scheduler and discarded after their result is emitted.
 *
 * @param enqueuedAtNanos {@link System#nanoTime()} at creation; drives the max-wait timer
 */
public record BatchItem(
    String jobId,
    String fileId,
    int sequence,
    String filename,
    String markdown,
    String error,
    boolean skipped,
    AnalysisContext context,
    long enqueuedAtNanos) {

  public static BatchItem converted(
      String jobId,
      String fileId,
      int sequence,
      String filename,
      String markdown,
      AnalysisContext context) {
    return new BatchItem(
        jobId, fileId, sequence, filename, markdown, null, false, context, System.nanoTime());
  }

  public static BatchItem failed(
      String jobId,
      String fileId,
      int sequence,
      String filename,
      String error,
      AnalysisContext context) {
    return new BatchItem(
        jobId, fileId, sequence, filename, null, error, false, context, System.nanoTime());
  }

  public static BatchItem skipped(
      String jobId, String fileId, int sequence, String filename, AnalysisContext context) {
    return new BatchItem(
        jobId, fileId, sequence, filename, null, "Cancelled", true, context, System.nanoTime());
  }

  public boolean isConverted() {
    return markdown != null && error == null;
  }
}

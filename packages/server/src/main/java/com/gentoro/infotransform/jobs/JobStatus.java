package com.gentoro.infotransform.jobs;

/** Lifecycle state of a submitted job. */
public enum JobStatus {
  /** Accepted, waiting for a pipeline thread. */
  QUEUED,
  /** Files are being converted and analyzed. */
  PROCESSING,
  /** Every file produced a terminal result; some of them may be failures. */
  COMPLETED,
  /** The pipeline itself failed. */
  FAILED,
  /** Cancellation was requested and every file has been accounted for. */
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }
}

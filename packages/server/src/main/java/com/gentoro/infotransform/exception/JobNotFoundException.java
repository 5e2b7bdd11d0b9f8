package com.gentoro.infotransform.exception;

/** Raised when a job id is unknown or has already been purged. */
public class JobNotFoundException extends InfoTransformException {
  private final String jobId;

  public JobNotFoundException(String jobId) {
    super(InfoTransformErrorCode.JOB_NOT_FOUND, "Unknown jobId: " + jobId);
    this.jobId = jobId;
  }

  public String jobId() {
    return jobId;
  }
}

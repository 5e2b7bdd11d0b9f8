package com.gentoro.infotransform.jobs;

/** Checked by pipeline stages at safe boundaries to cooperatively stop work for a job. */
@FunctionalInterface
public interface CancelChecker {
  CancelChecker NEVER = jobId -> false;

  boolean isCancelled(String jobId);
}

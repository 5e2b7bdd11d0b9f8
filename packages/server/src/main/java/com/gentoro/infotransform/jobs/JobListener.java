package com.gentoro.infotransform.jobs;

/**
 * Receives job events. Called while the job is locked so events of one job arrive in order;
 * implementations must return quickly.
 */
@FunctionalInterface
public interface JobListener {
  void onEvent(JobEvent event);
}

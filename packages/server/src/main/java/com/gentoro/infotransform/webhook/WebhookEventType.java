package com.gentoro.infotransform.webhook;

import com.gentoro.infotransform.jobs.JobEventType;

/** Event names as they appear on the wire. */
public enum WebhookEventType {
  JOB_STARTED("job.started"),
  JOB_PROGRESS("job.progress"),
  JOB_COMPLETED("job.completed"),
  JOB_CANCELLED("job.cancelled"),
  JOB_FAILED("job.failed");

  private final String wireName;

  WebhookEventType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static WebhookEventType of(JobEventType type) {
    return switch (type) {
      case STARTED -> JOB_STARTED;
      case PROGRESS -> JOB_PROGRESS;
      case COMPLETED -> JOB_COMPLETED;
      case CANCELLED -> JOB_CANCELLED;
      case FAILED -> JOB_FAILED;
    };
  }
}

package com.gentoro.infotransform.jobs;

public enum JobEventType {
  STARTED,
  PROGRESS,
  COMPLETED,
  CANCELLED,
  FAILED;

  static JobEventType terminal(JobStatus status) {
    return switch (status) {
      case COMPLETED -> COMPLETED;
      case CANCELLED -> CANCELLED;
      case FAILED -> FAILED;
      default -> throw new IllegalArgumentException("Not a terminal status: " + status);
    };
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED || this == FAILED;
  }
}

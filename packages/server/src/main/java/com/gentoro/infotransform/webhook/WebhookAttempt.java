package com.gentoro.infotransform.webhook;

import java.time.Duration;
import java.time.Instant;

/**
 * One delivery attempt.
 *
 * @param statusCode HTTP status, or 0 when no response was received
 * @param nextRetryIn delay before the next attempt; null unless {@code outcome} is FAILED
 */
public record WebhookAttempt(
    String deliveryId,
    String jobId,
    String url,
    WebhookEventType event,
    int attemptNumber,
    Outcome outcome,
    int statusCode,
    String error,
    String signature,
    Instant sentAt,
    Duration nextRetryIn) {

  public enum Outcome {
    DELIVERED,
    /** Failed; another attempt is scheduled. */
    FAILED,
    /** Failed and no attempts remain. */
    EXHAUSTED
  }

  public Instant nextRetryAt() {
    return nextRetryIn == null ? null : sentAt.plus(nextRetryIn);
  }
}

package com.gentoro.infotransform.webhook;

import com.gentoro.infotransform.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Exponential backoff: the delay after failed attempt {@code n} is {@code baseDelay *
 * multiplier^(n-1)}, capped at {@code maxDelay}.
 *
 * <p>Delays grow strictly until they reach {@code maxDelay}; every later retry waits exactly
 * {@code maxDelay}. A long attempt budget therefore ends in evenly spaced retries instead of
 * unbounded waits. Configure {@code maxDelay} above {@code baseDelay * multiplier^(maxAttempts-2)}
 * when every gap must be longer than the previous one.
 */
public record RetryPolicy(
    int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay) {
  public RetryPolicy {
    if (maxAttempts < 1) throw new ConfigException("webhook max-attempts must be at least 1");
    if (baseDelay.isNegative() || baseDelay.isZero()) {
      throw new ConfigException("webhook base-delay-ms must be positive");
    }
    if (!(multiplier > 1.0)) throw new ConfigException("webhook multiplier must be greater than 1");
    if (maxDelay.compareTo(baseDelay) < 0) {
      throw new ConfigException("webhook max-delay-ms must not be less than base-delay-ms");
    }
  }

  public static RetryPolicy fromConfiguration(Configuration webhook) {
    return new RetryPolicy(
        webhook.getInt("max-attempts", 3),
        Duration.ofMillis(webhook.getLong("base-delay-ms", 1000)),
        webhook.getDouble("multiplier", 2.0),
        Duration.ofMillis(webhook.getLong("max-delay-ms", 60000)));
  }

  /** Delay to wait after {@code failedAttempt} (1-based) before the next one. */
  public Duration delayAfter(int failedAttempt) {
    double millis = baseDelay.toMillis() * Math.pow(multiplier, failedAttempt - 1);
    return millis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(Math.round(millis));
  }

  public boolean hasAttemptAfter(int attempt) {
    return attempt < maxAttempts;
  }
}

package com.gentoro.infotransform.batch;

import com.gentoro.infotransform.exception.ConfigException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Chooses the target size of the next batch from the wall-clock durations of recent batches.
 *
 * <p>When the rolling average exceeds the target response time the size shrinks toward {@code
 * min}; when it is below half the target it grows toward {@code max}. Each adjustment moves by at
 * most {@code max(1, round(current * stepFactor))}. The size never leaves {@code [min, max]}.
 */
public final class AdaptiveBatchSizer {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(AdaptiveBatchSizer.class);

  private final boolean enabled;
  private final int minSize;
  private final int maxSize;
  private final long targetMillis;
  private final int minSamples;
  private final int window;
  private final double stepFactor;

  private final Deque<Long> recent = new ArrayDeque<>();
  private int current;

  public AdaptiveBatchSizer(
      boolean enabled,
      int initialSize,
      int minSize,
      int maxSize,
      Duration targetResponseTime,
      int minSamples,
      int window,
      double stepFactor) {
    if (minSize <= 0 || maxSize <= 0) throw new ConfigException("batch sizes must be positive");
    if (minSize > maxSize) {
      throw new ConfigException(
          "batching.adaptive.min-batch-size (" + minSize + ") exceeds max (" + maxSize + ")");
    }
    if (initialSize <= 0) throw new ConfigException("batching.batch-size must be positive");
    if (window <= 0 || minSamples <= 0) {
      throw new ConfigException("batching.adaptive window and min-samples must be positive");
    }
    if (stepFactor <= 0 || stepFactor >= 1) {
      throw new ConfigException("batching.adaptive.step-factor must be in (0, 1)");
    }
    this.enabled = enabled;
    this.minSize = minSize;
    this.maxSize = maxSize;
    this.targetMillis = targetResponseTime.toMillis();
    this.minSamples = Math.min(minSamples, window);
    this.window = window;
    this.stepFactor = stepFactor;
    this.current = enabled ? clamp(initialSize) : initialSize;
  }

  /** A sizer that always returns {@code size}. */
  public static AdaptiveBatchSizer fixed(int size) {
    return new AdaptiveBatchSizer(
        false, size, 1, Math.max(1, size), Duration.ofSeconds(1), 1, 1, 0.5);
  }

  public static AdaptiveBatchSizer fromConfiguration(Configuration batching) {
    Configuration adaptive = batching.subset("adaptive");
    return new AdaptiveBatchSizer(
        adaptive.getBoolean("enabled", true),
        batching.getInt("batch-size", 10),
        adaptive.getInt("min-batch-size", 5),
        adaptive.getInt("max-batch-size", 20),
        Duration.ofMillis(adaptive.getLong("target-response-time-ms", 5000)),
        adaptive.getInt("min-samples", 3),
        adaptive.getInt("window", 10),
        adaptive.getDouble("step-factor", 0.2));
  }

  public synchronized int currentSize() {
    return current;
  }

  /** Record the duration of a closed batch and return the size for the next one. */
  public synchronized int recordBatch(Duration duration) {
    if (!enabled) return current;
    recent.addLast(duration.toMillis());
    while (recent.size() > window) recent.removeFirst();
    if (recent.size() < minSamples) return current;

    long sum = 0;
    for (long d : recent) sum += d;
    long average = sum / recent.size();
    int step = Math.max(1, (int) Math.round(current * stepFactor));
    int next = current;
    if (average > targetMillis) {
      next = Math.max(minSize, current - step);
    } else if (average < targetMillis / 2) {
      next = Math.min(maxSize, current + step);
    }
    if (next != current) {
      log.info(
          "Adjusting batch size from {} to {} (avg batch time: {}ms, target: {}ms)",
          current,
          next,
          average,
          targetMillis);
      current = next;
    }
    return current;
  }

  public boolean enabled() {
    return enabled;
  }

  public int minSize() {
    return minSize;
  }

  public int maxSize() {
    return maxSize;
  }

  private int clamp(int size) {
    return Math.max(minSize, Math.min(maxSize, size));
  }
}

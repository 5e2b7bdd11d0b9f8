package com.gentoro.infotransform.conversion;

import java.util.concurrent.atomic.LongAdder;

/** Running totals of the converter pool. */
public final class ConversionMetrics {
  private final LongAdder processed = new LongAdder();
  private final LongAdder successful = new LongAdder();
  private final LongAdder failed = new LongAdder();
  private final LongAdder timedOut = new LongAdder();
  private final LongAdder totalMillis = new LongAdder();

  void recordSuccess(long millis) {
    processed.increment();
    successful.increment();
    totalMillis.add(millis);
  }

  void recordFailure(long millis, boolean timeout) {
    processed.increment();
    failed.increment();
    if (timeout) timedOut.increment();
    totalMillis.add(millis);
  }

  public Snapshot snapshot() {
    long total = processed.sum();
    long ok = successful.sum();
    return new Snapshot(
        total,
        ok,
        failed.sum(),
        timedOut.sum(),
        total == 0 ? 0d : (double) ok / total,
        total == 0 ? 0d : (double) totalMillis.sum() / total);
  }

  public record Snapshot(
      long totalProcessed,
      long successful,
      long failed,
      long timedOut,
      double successRate,
      double averageTimePerFileMs) {}
}

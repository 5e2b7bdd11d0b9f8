package com.gentoro.infotransform.batch;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/** Counters for dispatched batches. */
public final class BatchMetrics {
  private final LongAdder totalBatches = new LongAdder();
  private final LongAdder totalItems = new LongAdder();
  private final LongAdder totalMillis = new LongAdder();
  private final LongAdder successfulItems = new LongAdder();
  private final LongAdder failedItems = new LongAdder();
  private final LongAdder timedOutItems = new LongAdder();
  private final LongAdder skippedItems = new LongAdder();
  private final AtomicLong inFlight = new AtomicLong();

  void batchDispatched() {
    inFlight.incrementAndGet();
  }

  void batchClosed(int size, long millis) {
    inFlight.decrementAndGet();
    totalBatches.increment();
    totalItems.add(size);
    totalMillis.add(millis);
  }

  void itemResolved(BatchResult result) {
    if (result.success()) {
      successfulItems.increment();
    } else {
      failedItems.increment();
    }
  }

  void itemTimedOut() {
    timedOutItems.increment();
  }

  void itemSkipped() {
    skippedItems.increment();
  }

  public Snapshot snapshot(int currentBatchSize) {
    long batches = totalBatches.sum();
    long items = totalItems.sum();
    long millis = totalMillis.sum();
    return new Snapshot(
        batches,
        items,
        successfulItems.sum(),
        failedItems.sum(),
        timedOutItems.sum(),
        skippedItems.sum(),
        inFlight.get(),
        currentBatchSize,
        batches == 0 ? 0.0 : (double) items / batches,
        batches == 0 ? 0.0 : (double) millis / batches,
        items == 0 ? 0.0 : (double) millis / items);
  }

  public record Snapshot(
      long totalBatches,
      long totalItems,
      long successfulItems,
      long failedItems,
      long timedOutItems,
      long skippedItems,
      long batchesInFlight,
      int currentBatchSize,
      double averageBatchSize,
      double averageTimePerBatchMs,
      double averageTimePerItemMs) {}
}

package com.gentoro.infotransform.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * A group of items dispatched together. Each item resolves exactly once, either from its inference
 * call or from the batch timeout; whichever comes first wins and later outcomes are dropped.
 */
final class Batch {
  private final long id;
  private final List<Slot> slots;
  private final AtomicInteger unresolved;
  private volatile BatchState state = BatchState.ACCUMULATING;
  private volatile long dispatchedAtNanos;
  private volatile long closedAtNanos;

  Batch(long id, List<Pending> items) {
    this.id = id;
    this.slots = new ArrayList<>(items.size());
    for (Pending p : items) slots.add(new Slot(p));
    this.unresolved = new AtomicInteger(items.size());
  }

  long id() {
    return id;
  }

  int size() {
    return slots.size();
  }

  List<Slot> slots() {
    return slots;
  }

  BatchState state() {
    return state;
  }

  synchronized void markDispatched() {
    dispatchedAtNanos = System.nanoTime();
    state = BatchState.DISPATCHED;
  }

  enum Resolution {
    /** The slot was already resolved; the result was dropped. */
    IGNORED,
    RESOLVED,
    /** The slot was the last outstanding one; the batch is now closed. */
    CLOSED
  }

  /** Resolve one slot and emit its result if this is the first resolution. */
  Resolution resolve(Slot slot, BatchResult result) {
    if (state == BatchState.DISPATCHED) {
      synchronized (this) {
        if (state == BatchState.DISPATCHED) state = BatchState.DRAINING;
      }
    }
    // Emitting under the slot monitor keeps partial updates from trailing the terminal result.
    synchronized (slot) {
      if (slot.result != null) return Resolution.IGNORED;
      slot.result = result;
      slot.pending.emit(result);
    }
    if (unresolved.decrementAndGet() == 0) {
      synchronized (this) {
        closedAtNanos = System.nanoTime();
        state = BatchState.CLOSED;
      }
      return Resolution.CLOSED;
    }
    return Resolution.RESOLVED;
  }

  /** Emit a non-terminal update for a slot that has not resolved yet. */
  void emitPartial(Slot slot, BatchResult partial) {
    synchronized (slot) {
      if (slot.result == null) slot.pending.emit(partial);
    }
  }

  long elapsedMillis() {
    long end = state == BatchState.CLOSED ? closedAtNanos : System.nanoTime();
    return TimeUnit.NANOSECONDS.toMillis(end - dispatchedAtNanos);
  }

  /** Item in flight within a batch. */
  static final class Slot {
    final Pending pending;
    volatile Future<?> call;
    volatile long startedAtNanos;
    private BatchResult result;

    Slot(Pending pending) {
      this.pending = pending;
    }

    BatchItem item() {
      return pending.item();
    }

    synchronized boolean isResolved() {
      return result != null;
    }

    long elapsedMillis() {
      long start = startedAtNanos;
      return start == 0 ? 0 : TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
  }

  /** An item waiting in the scheduler together with the sink its results go to. */
  record Pending(BatchItem item, Consumer<BatchResult> sink, long arrivedAtNanos) {
    void emit(BatchResult result) {
      AdaptiveBatchScheduler.deliver(sink, result);
    }
  }
}

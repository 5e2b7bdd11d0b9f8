package com.gentoro.infotransform.batch;

/** Lifecycle of one dispatched batch. */
public enum BatchState {
  ACCUMULATING,
  DISPATCHED,
  /** At least one item has resolved and results are streaming out. */
  DRAINING,
  /** Every item produced a result or timed out; the concurrency slot is released. */
  CLOSED
}

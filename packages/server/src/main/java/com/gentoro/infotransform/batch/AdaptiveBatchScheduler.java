package com.gentoro.infotransform.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.infotransform.exception.ConfigException;
import com.gentoro.infotransform.exception.ExceptionUtil;
import com.gentoro.infotransform.exception.StateException;
import com.gentoro.infotransform.jobs.CancelChecker;
import com.gentoro.infotransform.model.InferenceClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Groups converted items into batches and runs inference on them, emitting one result per item as
 * soon as that item resolves.
 *
 * <p>A collector thread dispatches the buffered items when their count reaches the sizer's current
 * target or when the oldest buffered item has waited {@code maxWait}. At most {@code
 * maxConcurrentBatches} batches are in flight; the collector waits for a free slot before
 * dispatching the next one, which is also the point where cancelled jobs are checked. Items within
 * a batch run as independent inference calls. A batch that has not fully resolved within {@code
 * batchTimeout} resolves its remaining items as failures and frees its slot.
 *
 * <p>Items that need no inference (conversion failures, skipped items and cache hits) are resolved
 * directly by {@link #enqueue} without occupying a batch.
 */
public final class AdaptiveBatchScheduler implements AutoCloseable {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(AdaptiveBatchScheduler.class);

  static final String BATCH_TIMEOUT_ERROR = "Batch processing timeout";
  private static final long IDLE_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(200);

  private final InferenceClient inference;
  private final ResultCache cache;
  private final AdaptiveBatchSizer sizer;
  private final CancelChecker cancelChecker;
  private final Settings settings;
  private final BatchMetrics metrics = new BatchMetrics();

  private final BlockingQueue<Batch.Pending> input = new LinkedBlockingQueue<>();
  private final Semaphore slots;
  private final ExecutorService inferencePool;
  private final ScheduledExecutorService timers;
  private final AtomicLong batchIds = new AtomicLong();
  private final Object lifecycleLock = new Object();
  private volatile boolean running;
  private Thread collector;

  public AdaptiveBatchScheduler(
      InferenceClient inference,
      ResultCache cache,
      AdaptiveBatchSizer sizer,
      CancelChecker cancelChecker,
      Settings settings) {
    this.inference = inference;
    this.cache = cache;
    this.sizer = sizer;
    this.cancelChecker = cancelChecker;
    this.settings = settings;
    this.slots = new Semaphore(settings.maxConcurrentBatches(), true);
    this.inferencePool =
        Executors.newFixedThreadPool(settings.inferenceThreads(), daemonThreads("inference"));
    this.timers = Executors.newSingleThreadScheduledExecutor(daemonThreads("batch-timeouts"));
  }

  public static AdaptiveBatchScheduler fromConfiguration(
      Configuration batching,
      InferenceClient inference,
      ResultCache cache,
      CancelChecker cancelChecker) {
    AdaptiveBatchSizer sizer = AdaptiveBatchSizer.fromConfiguration(batching);
    return new AdaptiveBatchScheduler(
        inference, cache, sizer, cancelChecker, Settings.fromConfiguration(batching, sizer));
  }

  /** Start the collector thread. Idempotent. */
  public void start() {
    synchronized (lifecycleLock) {
      if (running) return;
      running = true;
      collector = new Thread(this::collectLoop, "batch-collector");
      collector.setDaemon(true);
      collector.start();
      log.info(
          "Batch scheduler started (size {}, max wait {}ms, {} concurrent batches, adaptive {})",
          sizer.currentSize(),
          settings.maxWait().toMillis(),
          settings.maxConcurrentBatches(),
          sizer.enabled());
    }
  }

  /**
   * Accept one item from the converter. Never blocks.
   *
   * @param sink receives every result for this item: optional partial updates, then exactly one
   *     terminal result
   */
  public void enqueue(BatchItem item, Consumer<BatchResult> sink) {
    if (item.skipped()) {
      metrics.itemSkipped();
      deliver(sink, BatchResult.skipped(item));
      return;
    }
    if (!item.isConverted()) {
      BatchResult failed = BatchResult.failure(item, item.error(), 0L);
      metrics.itemResolved(failed);
      deliver(sink, failed);
      return;
    }
    var hit = cache.get(item.markdown(), item.context());
    if (hit.isPresent()) {
      BatchResult cached = BatchResult.success(item, hit.get(), 0L, true);
      metrics.itemResolved(cached);
      deliver(sink, cached);
      return;
    }
    if (!running) {
      throw new StateException("Batch scheduler is not running");
    }
    input.add(new Batch.Pending(item, sink, System.nanoTime()));
  }

  private void collectLoop() {
    List<Batch.Pending> buffer = new ArrayList<>();
    while (running) {
      try {
        long waitNanos =
            buffer.isEmpty() ? IDLE_POLL_NANOS : settings.maxWait().toNanos() - oldestAge(buffer);
        if (waitNanos > 0 && buffer.size() < sizer.currentSize()) {
          Batch.Pending next = input.poll(waitNanos, TimeUnit.NANOSECONDS);
          if (next != null) {
            buffer.add(next);
            input.drainTo(buffer, Math.max(0, sizer.currentSize() - buffer.size()));
          }
        }
        if (buffer.isEmpty()) continue;
        int target = sizer.currentSize();
        boolean full = buffer.size() >= target;
        boolean waitedLongEnough = oldestAge(buffer) >= settings.maxWait().toNanos();
        if (full || waitedLongEnough) {
          slots.acquire();
          List<Batch.Pending> window = buffer.subList(0, Math.min(target, buffer.size()));
          List<Batch.Pending> group = new ArrayList<>(window);
          window.clear();
          dispatch(group);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (RuntimeException e) {
        log.error("Batch collector error", e);
      }
    }
    for (Batch.Pending p : buffer) {
      deliver(p.sink(), BatchResult.failure(p.item(), "Scheduler stopped", 0L));
    }
  }

  private static long oldestAge(List<Batch.Pending> buffer) {
    return System.nanoTime() - buffer.get(0).arrivedAtNanos();
  }

  /** Caller holds a slot. */
  private void dispatch(List<Batch.Pending> group) {
    List<Batch.Pending> live = new ArrayList<>(group.size());
    for (Batch.Pending p : group) {
      if (cancelChecker.isCancelled(p.item().jobId())) {
        metrics.itemSkipped();
        p.emit(BatchResult.skipped(p.item()));
      } else {
        live.add(p);
      }
    }
    if (live.isEmpty()) {
      slots.release();
      return;
    }

    Batch batch = new Batch(batchIds.incrementAndGet(), live);
    batch.markDispatched();
    metrics.batchDispatched();
    log.debug("Dispatching batch {} with {} items", batch.id(), batch.size());

    ScheduledFuture<?> timeout =
        timers.schedule(
            () -> expire(batch), settings.batchTimeout().toMillis(), TimeUnit.MILLISECONDS);
    for (Batch.Slot slot : batch.slots()) {
      try {
        slot.call = inferencePool.submit(() -> analyze(batch, slot, timeout));
      } catch (RejectedExecutionException e) {
        resolve(batch, slot, BatchResult.failure(slot.item(), "Scheduler stopped", 0L), timeout);
      }
    }
  }

  private void analyze(Batch batch, Batch.Slot slot, ScheduledFuture<?> timeout) {
    BatchItem item = slot.item();
    slot.startedAtNanos = System.nanoTime();
    BatchResult result;
    try {
      JsonNode payload =
          inference.analyzeStreaming(
              item.markdown(),
              item.context(),
              settings.itemTimeout(),
              partial ->
                  batch.emitPartial(
                      slot, BatchResult.partial(item, partial, slot.elapsedMillis())));
      if (payload == null) {
        result = BatchResult.failure(item, "Empty inference result", slot.elapsedMillis());
      } else {
        result = BatchResult.success(item, payload, slot.elapsedMillis(), false);
        cache.put(item.markdown(), item.context(), payload);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      result = BatchResult.failure(item, "Inference interrupted", slot.elapsedMillis());
    } catch (Exception e) {
      log.warn("Inference failed for {}: {}", item.filename(), e.getMessage());
      result =
          BatchResult.failure(item, ExceptionUtil.extractErrorMessage(e), slot.elapsedMillis());
    }
    resolve(batch, slot, result, timeout);
  }

  private void expire(Batch batch) {
    int expired = 0;
    for (Batch.Slot slot : batch.slots()) {
      if (slot.isResolved()) continue;
      BatchResult failed =
          BatchResult.failure(slot.item(), BATCH_TIMEOUT_ERROR, batch.elapsedMillis());
      if (resolve(batch, slot, failed, null) == Batch.Resolution.IGNORED) continue;
      metrics.itemTimedOut();
      expired++;
      if (slot.call != null) slot.call.cancel(true);
    }
    if (expired > 0) {
      log.warn(
          "Batch {} timed out after {}ms; {} item(s) resolved as failures",
          batch.id(),
          settings.batchTimeout().toMillis(),
          expired);
    }
  }

  private Batch.Resolution resolve(
      Batch batch, Batch.Slot slot, BatchResult result, ScheduledFuture<?> timeout) {
    Batch.Resolution resolution = batch.resolve(slot, result);
    if (resolution == Batch.Resolution.IGNORED) return resolution;
    metrics.itemResolved(result);
    if (resolution != Batch.Resolution.CLOSED) return resolution;

    if (timeout != null) timeout.cancel(false);
    long millis = batch.elapsedMillis();
    metrics.batchClosed(batch.size(), millis);
    sizer.recordBatch(Duration.ofMillis(millis));
    slots.release();
    log.debug("Batch {} closed after {}ms", batch.id(), millis);
    return resolution;
  }

  static void deliver(Consumer<BatchResult> sink, BatchResult result) {
    try {
      sink.accept(result);
    } catch (RuntimeException e) {
      log.error("Result sink failed for {}", result.filename(), e);
    }
  }

  public BatchMetrics.Snapshot metrics() {
    return metrics.snapshot(sizer.currentSize());
  }

  public AdaptiveBatchSizer sizer() {
    return sizer;
  }

  public Settings settings() {
    return settings;
  }

  /** Number of batch slots currently free. */
  public int availableSlots() {
    return slots.availablePermits();
  }

  @Override
  public void close() {
    Thread t;
    synchronized (lifecycleLock) {
      running = false;
      t = collector;
      collector = null;
    }
    if (t != null) t.interrupt();
    inferencePool.shutdownNow();
    timers.shutdownNow();
    log.info("Batch scheduler stopped");
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  /**
   * Scheduler tuning.
   *
   * @param inferenceThreads size of the pool running per-item inference calls
   */
  public record Settings(
      Duration maxWait,
      int maxConcurrentBatches,
      Duration batchTimeout,
      Duration itemTimeout,
      int inferenceThreads) {
    public Settings {
      if (maxWait.isNegative()) {
        throw new ConfigException("batching.max-wait-ms must not be negative");
      }
      if (maxConcurrentBatches <= 0) {
        throw new ConfigException("batching.max-concurrent-batches must be positive");
      }
      if (batchTimeout.isZero() || batchTimeout.isNegative()) {
        throw new ConfigException("batching.timeout-per-batch-seconds must be positive");
      }
      if (itemTimeout.isZero() || itemTimeout.isNegative()) {
        throw new ConfigException("batching.item-timeout-seconds must be positive");
      }
      if (inferenceThreads <= 0) throw new ConfigException("inference threads must be positive");
    }

    public static Settings fromConfiguration(Configuration batching, AdaptiveBatchSizer sizer) {
      int concurrent = batching.getInt("max-concurrent-batches", 3);
      int widest = sizer.enabled() ? sizer.maxSize() : sizer.currentSize();
      return new Settings(
          Duration.ofMillis(batching.getLong("max-wait-ms", 2000)),
          concurrent,
          Duration.ofSeconds(batching.getLong("timeout-per-batch-seconds", 60)),
          Duration.ofSeconds(batching.getLong("item-timeout-seconds", 60)),
          batching.getInt("inference-threads", concurrent * widest));
    }
  }
}

package com.gentoro.infotransform.conversion;

import com.gentoro.infotransform.batch.BatchItem;
import com.gentoro.infotransform.exception.ConfigException;
import com.gentoro.infotransform.exception.ExceptionUtil;
import com.gentoro.infotransform.files.ManagedFile;
import com.gentoro.infotransform.files.ManagedFileStore;
import com.gentoro.infotransform.jobs.CancelChecker;
import com.gentoro.infotransform.model.AnalysisContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Converts managed files to markdown on a fixed-size worker pool.
 *
 * <p>Each file yields exactly one {@link BatchItem}: markdown on success, an error on failure or
 * timeout. Items are handed to the sink in completion order. The work queue is bounded, so {@link
 * #convertAll} blocks the submitting thread while it is full. A conversion that exceeds its
 * timeout is reported immediately and its worker is interrupted.
 */
public final class ParallelConverterPool implements AutoCloseable {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(ParallelConverterPool.class);

  private final DocumentConverter converter;
  private final ManagedFileStore fileStore;
  private final Duration timeoutPerFile;
  private final int workers;
  private final WorkerType workerType;
  private final ThreadPoolExecutor executor;
  private final ScheduledExecutorService timeouts;
  private final ConversionMetrics metrics = new ConversionMetrics();

  public ParallelConverterPool(
      DocumentConverter converter,
      ManagedFileStore fileStore,
      int maxWorkers,
      WorkerType workerType,
      Duration timeoutPerFile,
      int queueCapacity) {
    if (maxWorkers <= 0) throw new ConfigException("conversion.max-workers must be positive");
    if (queueCapacity <= 0) throw new ConfigException("conversion.queue-capacity must be positive");
    if (timeoutPerFile.isZero() || timeoutPerFile.isNegative()) {
      throw new ConfigException("conversion.timeout-per-file-seconds must be positive");
    }
    this.converter = converter;
    this.fileStore = fileStore;
    this.timeoutPerFile = timeoutPerFile;
    this.workerType = workerType;
    this.workers = workerType.threads(maxWorkers);

    AtomicInteger seq = new AtomicInteger();
    this.executor =
        new ThreadPoolExecutor(
            workers,
            workers,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            r -> {
              Thread t = new Thread(r, "converter-" + seq.incrementAndGet());
              t.setDaemon(true);
              return t;
            },
            (r, pool) -> {
              if (pool.isShutdown()) {
                throw new RejectedExecutionException("Converter pool is shut down");
              }
              try {
                pool.getQueue().put(r);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RejectedExecutionException(
                    "Interrupted while waiting for queue space", e);
              }
            });
    this.timeouts =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "converter-timeouts");
              t.setDaemon(true);
              return t;
            });
    log.info(
        "Initialized {} converter pool with {} workers (queue {}, timeout {}s)",
        workerType,
        workers,
        queueCapacity,
        timeoutPerFile.toSeconds());
  }

  public static ParallelConverterPool fromConfiguration(
      Configuration conversion, DocumentConverter converter, ManagedFileStore fileStore) {
    return new ParallelConverterPool(
        converter,
        fileStore,
        conversion.getInt("max-workers", 10),
        WorkerType.parse(conversion.getString("worker-type", "io")),
        Duration.ofSeconds(conversion.getLong("timeout-per-file-seconds", 30)),
        conversion.getInt("queue-capacity", 100));
  }

  /**
   * Submit every file of a job for conversion. Returns once all files are queued, which may block
   * while the work queue is full.
   *
   * @param sink receives one item per file, in completion order, possibly from several threads
   * @return completes after the sink has received every item
   */
  public CompletableFuture<Void> convertAll(
      String jobId,
      List<ManagedFile> files,
      AnalysisContext context,
      CancelChecker cancelChecker,
      Consumer<BatchItem> sink) {
    log.info("Starting parallel conversion of {} files for job {}", files.size(), jobId);
    List<CompletableFuture<Void>> delivered = new ArrayList<>(files.size());
    for (int i = 0; i < files.size(); i++) {
      FileConversion conversion =
          new FileConversion(jobId, files.get(i), i, context, cancelChecker);
      delivered.add(conversion.outcome.thenAccept(item -> deliver(sink, item)));
      FutureTask<Void> task = new FutureTask<>(conversion, null);
      conversion.task = task;
      try {
        executor.execute(task);
      } catch (RejectedExecutionException e) {
        conversion.outcome.complete(
            BatchItem.failed(
                jobId,
                conversion.file.id(),
                i,
                conversion.file.filename(),
                "Conversion rejected: " + e.getMessage(),
                context));
      }
    }
    return CompletableFuture.allOf(delivered.toArray(CompletableFuture[]::new));
  }

  private static void deliver(Consumer<BatchItem> sink, BatchItem item) {
    try {
      sink.accept(item);
    } catch (RuntimeException e) {
      log.error("Conversion sink failed for {}", item.filename(), e);
    }
  }

  public ConversionMetrics.Snapshot metrics() {
    return metrics.snapshot();
  }

  public int workers() {
    return workers;
  }

  public WorkerType workerType() {
    return workerType;
  }

  @Override
  public void close() {
    executor.shutdownNow();
    timeouts.shutdownNow();
    log.info("Converter pool shutdown complete");
  }

  static String describe(Duration timeout) {
    long millis = timeout.toMillis();
    return millis % 1000 == 0 ? (millis / 1000) + " seconds" : millis + " ms";
  }

  private final class FileConversion implements Runnable {
    private final String jobId;
    private final ManagedFile file;
    private final int sequence;
    private final AnalysisContext context;
    private final CancelChecker cancelChecker;
    private final CompletableFuture<BatchItem> outcome = new CompletableFuture<>();
    private volatile FutureTask<Void> task;
    private volatile long startedAt;

    FileConversion(
        String jobId,
        ManagedFile file,
        int sequence,
        AnalysisContext context,
        CancelChecker cancelChecker) {
      this.jobId = jobId;
      this.file = file;
      this.sequence = sequence;
      this.context = context;
      this.cancelChecker = cancelChecker;
    }

    @Override
    public void run() {
      if (cancelChecker.isCancelled(jobId)) {
        outcome.complete(BatchItem.skipped(jobId, file.id(), sequence, file.filename(), context));
        return;
      }
      startedAt = System.nanoTime();
      ScheduledFuture<?> timer =
          timeouts.schedule(this::onTimeout, timeoutPerFile.toMillis(), TimeUnit.MILLISECONDS);
      try {
        BatchItem item = convert();
        if (outcome.complete(item)) {
          long millis = elapsedMillis();
          if (item.isConverted()) {
            metrics.recordSuccess(millis);
          } else {
            metrics.recordFailure(millis, false);
          }
        }
      } finally {
        timer.cancel(false);
      }
    }

    private BatchItem convert() {
      String typeHint = TypeHints.resolve(file.filename(), file.mediaType());
      ManagedFile acquired;
      try {
        acquired = fileStore.acquire(file.id());
      } catch (RuntimeException e) {
        return failed(ExceptionUtil.extractErrorMessage(e));
      }
      try {
        byte[] bytes = fileStore.readBytes(acquired);
        String markdown = converter.convert(bytes, typeHint, timeoutPerFile);
        if (markdown == null || markdown.isBlank()) {
          return failed("No content extracted");
        }
        log.debug("Converted {} ({} chars)", file.filename(), markdown.length());
        return BatchItem.converted(jobId, file.id(), sequence, file.filename(), markdown, context);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return failed("Conversion interrupted");
      } catch (Exception e) {
        log.warn("Error converting {}: {}", file.filename(), e.getMessage());
        return failed(ExceptionUtil.extractErrorMessage(e));
      } finally {
        fileStore.release(file.id());
      }
    }

    private void onTimeout() {
      BatchItem timedOut = failed("Timeout after " + describe(timeoutPerFile));
      if (outcome.complete(timedOut)) {
        metrics.recordFailure(elapsedMillis(), true);
        log.warn("Conversion of {} timed out after {}", file.filename(), describe(timeoutPerFile));
        FutureTask<Void> t = task;
        if (t != null) t.cancel(true);
      }
    }

    private BatchItem failed(String error) {
      return BatchItem.failed(jobId, file.id(), sequence, file.filename(), error, context);
    }

    private long elapsedMillis() {
      return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }
  }
}

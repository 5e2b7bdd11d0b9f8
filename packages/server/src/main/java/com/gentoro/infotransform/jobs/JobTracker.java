package com.gentoro.infotransform.jobs;

import com.gentoro.infotransform.batch.BatchResult;
import com.gentoro.infotransform.exception.ConfigException;
import com.gentoro.infotransform.exception.JobNotFoundException;
import com.gentoro.infotransform.webhook.WebhookConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Records job state and progress.
 *
 * <p>Counts only change through {@link #record(String, BatchResult)}, one terminal result per file.
 * When every file is accounted for the job becomes {@link JobStatus#COMPLETED}, or {@link
 * JobStatus#CANCELLED} if cancellation was requested. Terminal jobs are purged after the
 * retention window; later reads fail with {@link JobNotFoundException}.
 */
public final class JobTracker implements CancelChecker, AutoCloseable {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(JobTracker.class);

  private final JobStore store;
  private final Duration retention;
  private final Duration purgeInterval;
  private final Clock clock;
  private final List<JobListener> listeners = new CopyOnWriteArrayList<>();
  private final List<Consumer<String>> purgeListeners = new CopyOnWriteArrayList<>();

  private final Object lifecycleLock = new Object();
  private ScheduledExecutorService purger;

  public JobTracker(JobStore store, Duration retention, Duration purgeInterval, Clock clock) {
    if (retention.isNegative()) {
      throw new ConfigException("jobs.retention-seconds must not be negative");
    }
    if (purgeInterval.isZero() || purgeInterval.isNegative()) {
      throw new ConfigException("jobs.purge-interval-seconds must be positive");
    }
    this.store = store;
    this.retention = retention;
    this.purgeInterval = purgeInterval;
    this.clock = clock;
  }

  public static JobTracker fromConfiguration(Configuration jobs, JobStore store) {
    return new JobTracker(
        store,
        Duration.ofSeconds(jobs.getLong("retention-seconds", 3600)),
        Duration.ofSeconds(jobs.getLong("purge-interval-seconds", 60)),
        Clock.systemUTC());
  }

  /** Start the periodic purge of expired jobs. Idempotent. */
  public void start() {
    synchronized (lifecycleLock) {
      if (purger != null) return;
      purger =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "job-purger");
                t.setDaemon(true);
                return t;
              });
      long millis = purgeInterval.toMillis();
      purger.scheduleWithFixedDelay(this::purgeSafely, millis, millis, TimeUnit.MILLISECONDS);
    }
  }

  public void addListener(JobListener listener) {
    listeners.add(listener);
  }

  /** Called with the id of each job removed by {@link #purgeExpired()}. */
  public void onPurge(Consumer<String> listener) {
    purgeListeners.add(listener);
  }

  /**
   * Create a job in {@link JobStatus#QUEUED}.
   *
   * @param batchId file-store batch holding the job's files
   * @param fileIds one entry per file; the job is complete when each has a terminal result
   * @param webhook optional notification target
   */
  public String submit(String batchId, List<String> fileIds, WebhookConfig webhook) {
    String id = UUID.randomUUID().toString();
    store.put(new JobRecord(id, batchId, clock.instant(), fileIds, webhook));
    log.info("Job {} queued with {} file(s)", id, fileIds.size());
    return id;
  }

  /** @throws JobNotFoundException if the job is unknown or was purged */
  public JobView status(String jobId) {
    return view(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  public Optional<JobView> view(String jobId) {
    return store
        .get(jobId)
        .map(
            r -> {
              synchronized (r) {
                return JobView.of(r);
              }
            });
  }

  /**
   * Request cooperative cancellation. Work already dispatched finishes; files not yet dispatched
   * are skipped. Idempotent.
   *
   * @return {@code false} if the job is unknown
   */
  public boolean cancel(String jobId) {
    Optional<JobRecord> rec = store.get(jobId);
    if (rec.isEmpty()) return false;
    JobRecord r = rec.get();
    synchronized (r) {
      if (r.status.isTerminal() || r.cancelRequested) return true;
      r.cancelRequested = true;
      r.message = "Cancellation requested";
      log.info("Cancellation requested for job {}", jobId);
    }
    return true;
  }

  @Override
  public boolean isCancelled(String jobId) {
    return store
        .get(jobId)
        .map(
            r -> {
              synchronized (r) {
                return r.cancelRequested;
              }
            })
        .orElse(false);
  }

  /** {@code QUEUED -> PROCESSING}. A job with no files finishes immediately. */
  public void markProcessing(String jobId) {
    JobRecord r = require(jobId);
    synchronized (r) {
      if (r.status != JobStatus.QUEUED) return;
      r.status = JobStatus.PROCESSING;
      r.startedAt = clock.instant();
      log.info("Job {} processing", jobId);
      fire(JobEventType.STARTED, r, null);
      if (r.total() == 0) finish(r);
    }
  }

  /**
   * Account for one result. Partial results, results for unknown files and repeated results for
   * the same file are ignored.
   *
   * @return {@code true} if the result changed the job's counts
   */
  public boolean record(String jobId, BatchResult result) {
    if (!result.terminal()) return false;
    Optional<JobRecord> rec = store.get(jobId);
    if (rec.isEmpty()) {
      log.warn("Result for unknown job {} ({})", jobId, result.filename());
      return false;
    }
    JobRecord r = rec.get();
    synchronized (r) {
      if (r.status.isTerminal()
          || !r.fileIds.contains(result.fileId())
          || !r.resolved.add(result.fileId())) {
        log.debug("Ignoring result for {} in job {}", result.filename(), jobId);
        return false;
      }
      if (result.skipped()) {
        r.skipped++;
      } else if (result.success()) {
        r.completed++;
      } else {
        r.failed++;
      }
      fire(JobEventType.PROGRESS, r, result);
      if (r.accounted() == r.total()) finish(r);
      return true;
    }
  }

  /** Fail the job because the pipeline itself broke. No-op for terminal jobs. */
  public void markFailed(String jobId, String message) {
    Optional<JobRecord> rec = store.get(jobId);
    if (rec.isEmpty()) return;
    JobRecord r = rec.get();
    synchronized (r) {
      if (r.status.isTerminal()) return;
      r.status = JobStatus.FAILED;
      r.message = message;
      r.finishedAt = clock.instant();
      log.error("Job {} failed: {}", jobId, message);
      fire(JobEventType.FAILED, r, null);
    }
  }

  /** Remove terminal jobs whose retention window has passed. */
  public int purgeExpired() {
    Instant cutoff = clock.instant().minus(retention);
    int purged = 0;
    for (JobRecord r : store.all()) {
      boolean expired;
      synchronized (r) {
        expired = r.status.isTerminal() && r.finishedAt != null && !r.finishedAt.isAfter(cutoff);
      }
      if (expired) {
        store.remove(r.id);
        purged++;
        purgeListeners.forEach(l -> l.accept(r.id));
      }
    }
    if (purged > 0) log.info("Purged {} expired job(s)", purged);
    return purged;
  }

  public List<JobView> all() {
    return store.all().stream()
        .map(
            r -> {
              synchronized (r) {
                return JobView.of(r);
              }
            })
        .toList();
  }

  @Override
  public void close() {
    synchronized (lifecycleLock) {
      if (purger != null) {
        purger.shutdownNow();
        purger = null;
      }
    }
  }

  /** Caller holds the record's monitor. */
  private void finish(JobRecord r) {
    r.status = r.cancelRequested ? JobStatus.CANCELLED : JobStatus.COMPLETED;
    r.finishedAt = clock.instant();
    r.message =
        r.cancelRequested
            ? "Cancelled"
            : "Processed %d file(s): %d succeeded, %d failed"
                .formatted(r.total(), r.completed, r.failed);
    log.info(
        "Job {} {}: {} succeeded, {} failed, {} skipped",
        r.id,
        r.status,
        r.completed,
        r.failed,
        r.skipped);
    fire(JobEventType.terminal(r.status), r, null);
  }

  /** Caller holds the record's monitor. */
  private void fire(JobEventType type, JobRecord r, BatchResult result) {
    JobEvent event = new JobEvent(type, JobView.of(r), result, r.webhook);
    for (JobListener l : listeners) {
      try {
        l.onEvent(event);
      } catch (RuntimeException e) {
        log.error("Job listener failed for {} {}", r.id, type, e);
      }
    }
  }

  private JobRecord require(String jobId) {
    return store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  private void purgeSafely() {
    try {
      purgeExpired();
    } catch (RuntimeException e) {
      log.error("Error purging jobs", e);
    }
  }
}

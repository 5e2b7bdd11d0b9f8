package com.gentoro.infotransform.pipeline;

import com.gentoro.infotransform.batch.AdaptiveBatchScheduler;
import com.gentoro.infotransform.batch.BatchResult;
import com.gentoro.infotransform.conversion.ParallelConverterPool;
import com.gentoro.infotransform.exception.ConfigException;
import com.gentoro.infotransform.exception.ExceptionUtil;
import com.gentoro.infotransform.files.ManagedFile;
import com.gentoro.infotransform.files.ManagedFileStore;
import com.gentoro.infotransform.jobs.JobEvent;
import com.gentoro.infotransform.jobs.JobEventType;
import com.gentoro.infotransform.jobs.JobListener;
import com.gentoro.infotransform.jobs.JobTracker;
import com.gentoro.infotransform.jobs.JobView;
import com.gentoro.infotransform.model.AnalysisContext;
import com.gentoro.infotransform.webhook.WebhookConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Runs submitted jobs through the file store, converter pool and batch scheduler.
 *
 * <p>Every file of a job holds one store reference from submission until its terminal result is
 * counted, so the retention fallback can never delete it mid-flight. When the job reaches a
 * terminal state its stream is completed and its file batch is marked stream-complete. At most
 * {@code maxConcurrentJobs} jobs run at once; others stay queued.
 */
public final class DocumentPipeline implements JobListener, AutoCloseable {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(DocumentPipeline.class);

  private final ManagedFileStore fileStore;
  private final ParallelConverterPool converter;
  private final AdaptiveBatchScheduler scheduler;
  private final JobTracker tracker;
  private final ResultBroadcaster broadcaster;
  private final ExecutorService jobExecutor;

  private final Map<String, Set<String>> heldFiles = new ConcurrentHashMap<>();
  private final Map<String, CompletableFuture<JobView>> completions = new ConcurrentHashMap<>();

  public DocumentPipeline(
      ManagedFileStore fileStore,
      ParallelConverterPool converter,
      AdaptiveBatchScheduler scheduler,
      JobTracker tracker,
      ResultBroadcaster broadcaster,
      int maxConcurrentJobs) {
    if (maxConcurrentJobs <= 0) throw new ConfigException("jobs.max-concurrent must be positive");
    this.fileStore = fileStore;
    this.converter = converter;
    this.scheduler = scheduler;
    this.tracker = tracker;
    this.broadcaster = broadcaster;
    AtomicInteger seq = new AtomicInteger();
    this.jobExecutor =
        Executors.newFixedThreadPool(
            maxConcurrentJobs,
            r -> {
              Thread t = new Thread(r, "pipeline-job-" + seq.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    tracker.addListener(this);
    tracker.onPurge(broadcaster::remove);
  }

  /**
   * Register the files, create the job and queue it. Returns without waiting for any processing.
   *
   * @param webhook optional notification target
   * @return the job id
   */
  public String submit(List<UploadedFile> files, AnalysisContext context, WebhookConfig webhook) {
    if (files.isEmpty()) throw new IllegalArgumentException("At least one file is required");
    String batchId = UUID.randomUUID().toString();
    List<ManagedFile> managed = new ArrayList<>(files.size());
    try {
      for (UploadedFile f : files) {
        ManagedFile file = fileStore.register(batchId, f.filename(), f.mediaType(), f.content());
        fileStore.acquire(file.id());
        managed.add(file);
      }
    } catch (RuntimeException e) {
      managed.forEach(f -> fileStore.release(f.id()));
      fileStore.markStreamComplete(batchId);
      throw e;
    }

    List<String> fileIds = managed.stream().map(ManagedFile::id).toList();
    Set<String> held = ConcurrentHashMap.newKeySet();
    held.addAll(fileIds);
    CompletableFuture<JobView> done = new CompletableFuture<>();

    String jobId = tracker.submit(batchId, fileIds, webhook);
    heldFiles.put(jobId, held);
    completions.put(jobId, done);
    broadcaster.open(jobId);
    jobExecutor.execute(() -> run(jobId, managed, context, done));
    return jobId;
  }

  private void run(
      String jobId,
      List<ManagedFile> files,
      AnalysisContext context,
      CompletableFuture<JobView> done) {
    try {
      JobView started = tracker.status(jobId);
      broadcaster.publish(
          jobId,
          StreamMessage.init(
              started,
              context.schemaKey(),
              scheduler.sizer().currentSize(),
              converter.workers()));
      tracker.markProcessing(jobId);
      converter
          .convertAll(
              jobId, files, context, tracker, item -> scheduler.enqueue(item, this::onResult))
          .join();
      // Hold this job slot until every file has a terminal result.
      done.join();
    } catch (RuntimeException e) {
      log.error("Pipeline failed for job {}", jobId, e);
      tracker.markFailed(jobId, ExceptionUtil.extractErrorMessage(e));
    }
  }

  private void onResult(BatchResult result) {
    if (result.terminal()) {
      tracker.record(result.jobId(), result);
    } else {
      tracker
          .view(result.jobId())
          .ifPresent(job -> broadcaster.publish(job.jobId(), StreamMessage.result(result, job)));
    }
  }

  @Override
  public void onEvent(JobEvent event) {
    String jobId = event.job().jobId();
    if (event.type() == JobEventType.PROGRESS) {
      BatchResult result = event.result();
      broadcaster.publish(jobId, StreamMessage.result(result, event.job()));
      Set<String> held = heldFiles.get(jobId);
      if (held != null && held.remove(result.fileId())) {
        fileStore.release(result.fileId());
      }
    } else if (event.type().isTerminal()) {
      broadcaster.publish(jobId, StreamMessage.complete(event.job()));
      Set<String> held = heldFiles.remove(jobId);
      if (held != null) {
        for (String fileId : held) fileStore.release(fileId);
      }
      fileStore.markStreamComplete(event.job().batchId());
      CompletableFuture<JobView> done = completions.remove(jobId);
      if (done != null) done.complete(event.job());
    }
  }

  /** Completes when the job reaches a terminal state. */
  public CompletableFuture<JobView> completion(String jobId) {
    CompletableFuture<JobView> done = completions.get(jobId);
    if (done != null) return done;
    return CompletableFuture.completedFuture(tracker.status(jobId));
  }

  public JobTracker tracker() {
    return tracker;
  }

  public ResultBroadcaster broadcaster() {
    return broadcaster;
  }

  @Override
  public void close() {
    jobExecutor.shutdownNow();
    log.info("Document pipeline stopped");
  }
}

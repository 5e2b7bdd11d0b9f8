package com.gentoro.infotransform;

import com.gentoro.infotransform.api.ApiServer;
import com.gentoro.infotransform.batch.AdaptiveBatchScheduler;
import com.gentoro.infotransform.batch.ResultCache;
import com.gentoro.infotransform.conversion.ParallelConverterPool;
import com.gentoro.infotransform.conversion.PlainTextConverter;
import com.gentoro.infotransform.conversion.RoutingDocumentConverter;
import com.gentoro.infotransform.exception.NetworkException;
import com.gentoro.infotransform.exception.StateException;
import com.gentoro.infotransform.files.ManagedFileStore;
import com.gentoro.infotransform.http.EmbeddedJettyServer;
import com.gentoro.infotransform.jobs.InMemoryJobStore;
import com.gentoro.infotransform.jobs.JobTracker;
import com.gentoro.infotransform.model.InferenceClient;
import com.gentoro.infotransform.model.InferenceClientFactory;
import com.gentoro.infotransform.pipeline.DocumentPipeline;
import com.gentoro.infotransform.pipeline.ResultBroadcaster;
import com.gentoro.infotransform.webhook.WebhookDispatcher;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/** Application container: builds every component from configuration and owns their lifecycle. */
public class InfoTransform {

  private static final org.slf4j.Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(InfoTransform.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ManagedFileStore fileStore;
  private ParallelConverterPool converterPool;
  private InferenceClient inferenceClient;
  private ResultCache resultCache;
  private JobTracker jobTracker;
  private AdaptiveBatchScheduler scheduler;
  private WebhookDispatcher webhookDispatcher;
  private DocumentPipeline pipeline;
  private EmbeddedJettyServer httpServer;
  private ScheduledExecutorService maintenance;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public InfoTransform(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    Configuration config = configuration();
    // Apply logging levels from application.yaml as early as possible
    com.gentoro.infotransform.logging.LoggingService.applyConfiguration(config);

    this.fileStore = ManagedFileStore.fromConfiguration(config.subset("files"));
    fileStore.start();

    this.converterPool =
        ParallelConverterPool.fromConfiguration(
            config.subset("conversion"),
            new RoutingDocumentConverter(List.of(new PlainTextConverter())),
            fileStore);

    this.inferenceClient = InferenceClientFactory.create(config.subset("llm"));
    this.resultCache = ResultCache.fromConfiguration(config.subset("result-cache"));

    this.jobTracker = JobTracker.fromConfiguration(config.subset("jobs"), new InMemoryJobStore());
    jobTracker.start();

    this.scheduler =
        AdaptiveBatchScheduler.fromConfiguration(
            config.subset("batching"), inferenceClient, resultCache, jobTracker);
    scheduler.start();

    this.webhookDispatcher = WebhookDispatcher.fromConfiguration(config.subset("webhook"));
    jobTracker.addListener(webhookDispatcher);

    this.pipeline =
        new DocumentPipeline(
            fileStore,
            converterPool,
            scheduler,
            jobTracker,
            new ResultBroadcaster(),
            config.getInt("jobs.max-concurrent", 4));

    startMaintenance(config.getLong("result-cache.purge-interval-seconds", 600));

    // Initialize shared Jetty server and register components
    Configuration http = config.subset("http");
    this.httpServer = new EmbeddedJettyServer(http);
    httpServer.prepare();
    try {
      new ApiServer(
              pipeline,
              converterPool,
              scheduler,
              resultCache,
              fileStore,
              webhookDispatcher,
              webhookDispatcher.defaultRetry(),
              http.getLong("max-upload-bytes", 50L * 1024 * 1024))
          .register(httpServer.getContextHandler());
      // Start Jetty (non-blocking)
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw new NetworkException("Could not start http server", e);
    }
    log.info("InfoTransform ready on port {}", httpServer.getPort());
  }

  private void startMaintenance(long intervalSeconds) {
    if (!resultCache.enabled() || intervalSeconds <= 0) return;
    this.maintenance =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "cache-purger");
              t.setDaemon(true);
              return t;
            });
    maintenance.scheduleWithFixedDelay(
        () -> {
          try {
            int purged = resultCache.purgeExpired();
            if (purged > 0) log.debug("Purged {} expired cache entries", purged);
          } catch (RuntimeException e) {
            log.warn("Cache purge failed", e);
          }
        },
        intervalSeconds,
        intervalSeconds,
        TimeUnit.SECONDS);
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    // Register a JVM shutdown hook once
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "infotransform-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    // Wait until shutdown is triggered
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down");
      try {
        // Stop accepting requests first, then drain the stages front to back.
        closeQuietly(httpServer);
        closeQuietly(pipeline);
        closeQuietly(converterPool);
        closeQuietly(scheduler);
        closeQuietly(webhookDispatcher);
        closeQuietly(jobTracker);
        if (maintenance != null) maintenance.shutdownNow();
        closeQuietly(fileStore);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.debug("Error closing {}: {}", closeable.getClass().getSimpleName(), e.getMessage());
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("InfoTransform not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public DocumentPipeline pipeline() {
    return pipeline;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}

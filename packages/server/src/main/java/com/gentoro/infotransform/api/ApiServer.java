package com.gentoro.infotransform.api;

import com.gentoro.infotransform.api.endpoints.JobsServlet;
import com.gentoro.infotransform.api.endpoints.JobsSubmitServlet;
import com.gentoro.infotransform.api.endpoints.MetricsServlet;
import com.gentoro.infotransform.api.endpoints.TransformServlet;
import com.gentoro.infotransform.batch.AdaptiveBatchScheduler;
import com.gentoro.infotransform.batch.ResultCache;
import com.gentoro.infotransform.conversion.ParallelConverterPool;
import com.gentoro.infotransform.exception.FileStoreException;
import com.gentoro.infotransform.files.ManagedFileStore;
import com.gentoro.infotransform.pipeline.DocumentPipeline;
import com.gentoro.infotransform.webhook.RetryPolicy;
import com.gentoro.infotransform.webhook.WebhookDispatcher;
import jakarta.servlet.MultipartConfigElement;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Registers the public HTTP endpoints under {@code /api} on a Jetty context.
 *
 * <ul>
 *   <li>POST /api/jobs: asynchronous submission
 *   <li>GET, DELETE /api/jobs/{id} and GET /api/jobs/{id}/events
 *   <li>POST /api/transform: submission answered with the event stream
 *   <li>GET /api/metrics
 * </ul>
 */
public final class ApiServer {
  private static final org.slf4j.Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(ApiServer.class);

  private final DocumentPipeline pipeline;
  private final ParallelConverterPool converter;
  private final AdaptiveBatchScheduler scheduler;
  private final ResultCache cache;
  private final ManagedFileStore fileStore;
  private final WebhookDispatcher webhooks;
  private final RetryPolicy webhookDefaults;
  private final long maxUploadBytes;

  public ApiServer(
      DocumentPipeline pipeline,
      ParallelConverterPool converter,
      AdaptiveBatchScheduler scheduler,
      ResultCache cache,
      ManagedFileStore fileStore,
      WebhookDispatcher webhooks,
      RetryPolicy webhookDefaults,
      long maxUploadBytes) {
    this.pipeline = pipeline;
    this.converter = converter;
    this.scheduler = scheduler;
    this.cache = cache;
    this.fileStore = fileStore;
    this.webhooks = webhooks;
    this.webhookDefaults = webhookDefaults;
    this.maxUploadBytes = maxUploadBytes;
  }

  private String contextPath() {
    return "/api";
  }

  /** Register all servlets with the Jetty context handler. */
  public void register(ServletContextHandler ctx) {
    ServletHolder submit = new ServletHolder(new JobsSubmitServlet(pipeline, webhookDefaults));
    submit.getRegistration().setMultipartConfig(multipartConfig());
    ctx.addServlet(submit, "%s/jobs".formatted(contextPath()));

    ctx.addServlet(
        new ServletHolder(new JobsServlet(pipeline.tracker(), pipeline.broadcaster())),
        "%s/jobs/*".formatted(contextPath()));

    ServletHolder transform = new ServletHolder(new TransformServlet(pipeline, webhookDefaults));
    transform.getRegistration().setMultipartConfig(multipartConfig());
    ctx.addServlet(transform, "%s/transform".formatted(contextPath()));

    ctx.addServlet(
        new ServletHolder(
            new MetricsServlet(
                converter, scheduler, cache, fileStore, pipeline.tracker(), webhooks)),
        "%s/metrics".formatted(contextPath()));
    log.info("Registered API endpoints under {}", contextPath());
  }

  private MultipartConfigElement multipartConfig() {
    Path spool = fileStore.root().resolve(".multipart");
    try {
      Files.createDirectories(spool);
    } catch (IOException e) {
      throw new FileStoreException("Unable to create multipart spool directory " + spool, e);
    }
    return new MultipartConfigElement(
        spool.toString(), maxUploadBytes, maxUploadBytes * 4, 1024 * 1024);
  }
}

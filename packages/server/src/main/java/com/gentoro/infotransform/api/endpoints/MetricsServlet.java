package com.gentoro.infotransform.api.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.infotransform.batch.AdaptiveBatchScheduler;
import com.gentoro.infotransform.batch.ResultCache;
import com.gentoro.infotransform.conversion.ParallelConverterPool;
import com.gentoro.infotransform.files.ManagedFileStore;
import com.gentoro.infotransform.jobs.JobStatus;
import com.gentoro.infotransform.jobs.JobTracker;
import com.gentoro.infotransform.jobs.JobView;
import com.gentoro.infotransform.utility.JacksonUtility;
import com.gentoro.infotransform.webhook.WebhookDispatcher;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /api/metrics: counters of every pipeline stage. */
public final class MetricsServlet extends HttpServlet {
  private final ParallelConverterPool converter;
  private final AdaptiveBatchScheduler scheduler;
  private final ResultCache cache;
  private final ManagedFileStore fileStore;
  private final JobTracker jobs;
  private final WebhookDispatcher webhooks;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public MetricsServlet(
      ParallelConverterPool converter,
      AdaptiveBatchScheduler scheduler,
      ResultCache cache,
      ManagedFileStore fileStore,
      JobTracker jobs,
      WebhookDispatcher webhooks) {
    this.converter = converter;
    this.scheduler = scheduler;
    this.cache = cache;
    this.fileStore = fileStore;
    this.jobs = jobs;
    this.webhooks = webhooks;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode node = mapper.createObjectNode();
    ObjectNode conversion = mapper.valueToTree(converter.metrics());
    conversion.put("workers", converter.workers());
    conversion.put("workerType", converter.workerType().name().toLowerCase());
    node.set("conversion", conversion);
    node.set("batching", mapper.valueToTree(scheduler.metrics()));
    node.set("cache", mapper.valueToTree(cache.stats()));
    node.set("files", mapper.valueToTree(fileStore.stats()));
    if (webhooks != null) node.set("webhooks", mapper.valueToTree(webhooks.stats()));

    ObjectNode jobCounts = node.putObject("jobs");
    for (JobStatus s : JobStatus.values()) jobCounts.put(s.name().toLowerCase(), 0);
    for (JobView v : jobs.all()) {
      String key = v.status().name().toLowerCase();
      jobCounts.put(key, jobCounts.get(key).asInt() + 1);
    }
    JsonResponses.write(resp, 200, node);
  }
}

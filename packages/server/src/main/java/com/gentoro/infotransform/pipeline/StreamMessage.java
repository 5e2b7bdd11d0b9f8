package com.gentoro.infotransform.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.infotransform.batch.BatchResult;
import com.gentoro.infotransform.jobs.JobView;
import com.gentoro.infotransform.utility.JacksonUtility;
import java.time.Duration;

/** One server-sent event of a job's result stream. */
public record StreamMessage(String type, ObjectNode body) {
  public static final String INIT = "init";
  public static final String RESULT = "result";
  public static final String COMPLETE = "complete";

  public boolean isComplete() {
    return COMPLETE.equals(type);
  }

  /** {@code data: <json>} framed for a {@code text/event-stream} response. */
  public String toSse() {
    return "data: " + JacksonUtility.toJson(body) + "\n\n";
  }

  static StreamMessage init(JobView job, String schemaKey, int batchSize, int workers) {
    ObjectNode body = newBody(INIT);
    body.put("jobId", job.jobId());
    body.put("totalFiles", job.totalCount());
    body.put("schemaKey", schemaKey);
    ObjectNode optimization = body.putObject("optimization");
    optimization.put("parallelConversion", true);
    optimization.put("batchProcessing", true);
    optimization.put("maxWorkers", workers);
    optimization.put("batchSize", batchSize);
    return new StreamMessage(INIT, body);
  }

  /**
   * @param job snapshot taken right after the result was counted; for partial results the
   *     snapshot from before
   */
  static StreamMessage result(BatchResult result, JobView job) {
    ObjectNode body = newBody(RESULT);
    body.put("fileId", result.fileId());
    body.put("filename", result.filename());
    body.put("status", result.success() ? "success" : "error");
    body.put("success", result.success());
    body.put("final", result.terminal());
    if (result.success()) {
      body.set("structuredData", result.payload());
    } else {
      body.put("error", result.error());
    }
    body.put("processingTimeMs", result.processingTimeMs());
    body.put("cached", result.cached());
    if (result.skipped()) body.put("skipped", true);
    ObjectNode progress = body.putObject("progress");
    progress.put("current", job.processedCount());
    progress.put("total", job.totalCount());
    progress.put("percent", job.percent());
    progress.put("successful", job.completedCount());
    progress.put("failed", job.failedCount() + job.skippedCount());
    return new StreamMessage(RESULT, body);
  }

  static StreamMessage complete(JobView job) {
    ObjectNode body = newBody(COMPLETE);
    body.put("jobId", job.jobId());
    body.put("status", job.status().name().toLowerCase());
    body.put("totalFiles", job.totalCount());
    body.put("successful", job.completedCount());
    body.put("failed", job.failedCount());
    body.put("skipped", job.skippedCount());
    if (job.startedAt() != null && job.finishedAt() != null) {
      long millis = Duration.between(job.startedAt(), job.finishedAt()).toMillis();
      body.put("durationMs", millis);
      body.put("filesPerSecond", millis == 0 ? 0.0 : job.totalCount() * 1000.0 / millis);
    }
    if (job.message() != null) body.put("message", job.message());
    return new StreamMessage(COMPLETE, body);
  }

  private static ObjectNode newBody(String type) {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("type", type);
    return body;
  }
}

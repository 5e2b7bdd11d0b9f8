package com.gentoro.infotransform.api.endpoints;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.infotransform.pipeline.DocumentPipeline;
import com.gentoro.infotransform.utility.JacksonUtility;
import com.gentoro.infotransform.webhook.RetryPolicy;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;

/**
 * POST /api/jobs: accepts a multipart submission and queues it.
 *
 * <pre>
 * { "jobId": "...", "status": "queued" }
 * </pre>
 */
public final class JobsSubmitServlet extends HttpServlet {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(JobsSubmitServlet.class);

  private final DocumentPipeline pipeline;
  private final RetryPolicy webhookDefaults;

  public JobsSubmitServlet(DocumentPipeline pipeline, RetryPolicy webhookDefaults) {
    this.pipeline = pipeline;
    this.webhookDefaults = webhookDefaults;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    SubmissionParser.Submission submission;
    try {
      submission = SubmissionParser.parse(req, webhookDefaults);
    } catch (IllegalArgumentException | ServletException e) {
      JsonResponses.error(resp, 400, e.getMessage());
      return;
    }
    try {
      String jobId =
          pipeline.submit(submission.files(), submission.context(), submission.webhook());
      ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
      node.put("jobId", jobId);
      node.put("status", "queued");
      JsonResponses.write(resp, 202, node);
    } catch (Exception e) {
      log.error("Failed to accept submission", e);
      JsonResponses.failure(resp, "Failed to accept submission", e);
    }
  }
}

package com.gentoro.infotransform.api.endpoints;

import com.gentoro.infotransform.pipeline.DocumentPipeline;
import com.gentoro.infotransform.webhook.RetryPolicy;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;

/**
 * POST /api/transform: same input as POST /api/jobs, but the response is the job's event stream.
 * Closing the connection does not cancel the job.
 */
public final class TransformServlet extends HttpServlet {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(TransformServlet.class);

  private final DocumentPipeline pipeline;
  private final RetryPolicy webhookDefaults;

  public TransformServlet(DocumentPipeline pipeline, RetryPolicy webhookDefaults) {
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
    String jobId;
    try {
      jobId = pipeline.submit(submission.files(), submission.context(), submission.webhook());
    } catch (Exception e) {
      log.error("Failed to start transform", e);
      JsonResponses.failure(resp, "Failed to start transform", e);
      return;
    }
    var subscription = pipeline.broadcaster().subscribe(jobId);
    if (subscription.isEmpty()) {
      JsonResponses.error(resp, 500, "Stream unavailable for job " + jobId);
      return;
    }
    resp.setHeader("X-Job-Id", jobId);
    EventStreamWriter.stream(subscription.get(), resp);
  }
}

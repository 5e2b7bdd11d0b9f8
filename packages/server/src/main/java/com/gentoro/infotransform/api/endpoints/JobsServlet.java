package com.gentoro.infotransform.api.endpoints;

import com.gentoro.infotransform.jobs.JobTracker;
import com.gentoro.infotransform.pipeline.ResultBroadcaster;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Per-job resource.
 *
 * <ul>
 *   <li>GET /api/jobs/{id}: job snapshot
 *   <li>GET /api/jobs/{id}/events: result stream, replayed from the start
 *   <li>DELETE /api/jobs/{id}: cooperative cancel
 * </ul>
 */
public final class JobsServlet extends HttpServlet {
  private static final String EVENTS_SUFFIX = "/events";

  private final JobTracker jobs;
  private final ResultBroadcaster broadcaster;

  public JobsServlet(JobTracker jobs, ResultBroadcaster broadcaster) {
    this.jobs = jobs;
    this.broadcaster = broadcaster;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String jobId = jobId(req);
    if (jobId == null) {
      JsonResponses.error(resp, 400, "Missing jobId");
      return;
    }
    if (jobId.endsWith(EVENTS_SUFFIX)) {
      jobId = jobId.substring(0, jobId.length() - EVENTS_SUFFIX.length());
      var subscription = broadcaster.subscribe(jobId);
      if (subscription.isEmpty()) {
        JsonResponses.error(resp, 404, "Unknown jobId");
        return;
      }
      EventStreamWriter.stream(subscription.get(), resp);
      return;
    }

    var view = jobs.view(jobId);
    if (view.isEmpty()) {
      JsonResponses.error(resp, 404, "Unknown jobId");
      return;
    }
    JsonResponses.write(resp, 200, JsonResponses.job(view.get()));
  }

  @Override
  protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String jobId = jobId(req);
    if (jobId == null) {
      JsonResponses.error(resp, 400, "Missing jobId");
      return;
    }
    if (!jobs.cancel(jobId)) {
      JsonResponses.error(resp, 404, "Unknown jobId");
      return;
    }
    JsonResponses.write(resp, 202, JsonResponses.job(jobs.status(jobId)));
  }

  private static String jobId(HttpServletRequest req) {
    String path = req.getPathInfo();
    if (path == null || path.length() <= 1) return null;
    return path.substring(1);
  }
}

package com.gentoro.infotransform.api.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.infotransform.exception.ErrorDetails;
import com.gentoro.infotransform.exception.ExceptionUtil;
import com.gentoro.infotransform.jobs.JobView;
import com.gentoro.infotransform.utility.JacksonUtility;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** Response helpers shared by the endpoints. */
final class JsonResponses {
  private JsonResponses() {}

  static void write(HttpServletResponse resp, int status, JsonNode body) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(JacksonUtility.toJson(body));
  }

  static void error(HttpServletResponse resp, int status, String message) throws IOException {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("error", message == null ? "Unknown error" : message);
    write(resp, status, node);
  }

  /** 500 response carrying the structured {@link ErrorDetails} of {@code t}. */
  static void failure(HttpServletResponse resp, String summary, Throwable t) throws IOException {
    ErrorDetails details = ExceptionUtil.toErrorDetails(t);
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("error", summary + ": " + ExceptionUtil.extractErrorMessage(t));
    node.put("code", details.code().name());
    node.put("type", details.type());
    if (details.context() != null && !details.context().isEmpty()) {
      node.set("context", JacksonUtility.getJsonMapper().valueToTree(details.context()));
    }
    node.put("trace", ExceptionUtil.formatCompactStackTrace(ExceptionUtil.unwrap(t), 5));
    write(resp, 500, node);
  }

  static ObjectNode job(JobView v) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("jobId", v.jobId());
    node.put("status", v.status().name().toLowerCase());
    node.put("totalCount", v.totalCount());
    node.put("completedCount", v.completedCount());
    node.put("failedCount", v.failedCount());
    node.put("skippedCount", v.skippedCount());
    node.put("percent", v.percent());
    node.put("cancelRequested", v.cancelRequested());
    if (v.message() != null) node.put("message", v.message());
    if (v.createdAt() != null) node.put("createdAt", v.createdAt().toString());
    if (v.startedAt() != null) node.put("startedAt", v.startedAt().toString());
    if (v.finishedAt() != null) node.put("finishedAt", v.finishedAt().toString());
    return node;
  }
}

package com.gentoro.infotransform.api.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.infotransform.model.AnalysisContext;
import com.gentoro.infotransform.pipeline.UploadedFile;
import com.gentoro.infotransform.utility.JacksonUtility;
import com.gentoro.infotransform.webhook.RetryPolicy;
import com.gentoro.infotransform.webhook.WebhookConfig;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.Part;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads a multipart submission: {@code files} parts, a {@code schema} JSON part, optional {@code
 * schemaKey}, {@code instructions}, {@code model} and {@code webhook} parts.
 *
 * <p>Invalid input raises {@link IllegalArgumentException}, reported as 400 by the endpoints.
 */
final class SubmissionParser {
  private SubmissionParser() {}

  record Submission(List<UploadedFile> files, AnalysisContext context, WebhookConfig webhook) {}

  static Submission parse(HttpServletRequest req, RetryPolicy webhookDefaults)
      throws IOException, ServletException {
    String contentType = req.getContentType();
    if (contentType == null || !contentType.toLowerCase().startsWith("multipart/form-data")) {
      throw new IllegalArgumentException("Expected multipart/form-data");
    }
    List<UploadedFile> files = new ArrayList<>();
    for (Part part : req.getParts()) {
      if (!"files".equals(part.getName())) continue;
      try (InputStream in = part.getInputStream()) {
        files.add(
            new UploadedFile(
                part.getSubmittedFileName(), part.getContentType(), in.readAllBytes()));
      }
    }
    if (files.isEmpty()) {
      throw new IllegalArgumentException("At least one file is required");
    }

    String schemaText = text(req, "schema");
    if (StringUtils.isBlank(schemaText)) {
      throw new IllegalArgumentException("Missing schema");
    }
    JsonNode schema = JacksonUtility.readTree(schemaText);
    if (schema == null || !schema.isObject()) {
      throw new IllegalArgumentException("schema must be a JSON object");
    }
    AnalysisContext context =
        new AnalysisContext(
            text(req, "schemaKey"),
            schema,
            text(req, "instructions"),
            StringUtils.trimToNull(text(req, "model")));

    WebhookConfig webhook = null;
    String webhookText = text(req, "webhook");
    if (StringUtils.isNotBlank(webhookText)) {
      webhook = WebhookConfig.fromJson(JacksonUtility.readTree(webhookText), webhookDefaults);
    }
    return new Submission(files, context, webhook);
  }

  private static String text(HttpServletRequest req, String name)
      throws IOException, ServletException {
    Part part = req.getPart(name);
    if (part == null) return null;
    try (InputStream in = part.getInputStream()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}

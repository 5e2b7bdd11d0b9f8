package com.gentoro.infotransform.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.infotransform.exception.ConfigException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-job notification target.
 *
 * @param headers extra request headers, sent verbatim
 * @param retry retry policy for this target
 * @param notifyProgress whether {@code job.progress} events are sent
 */
public record WebhookConfig(
    String url, Map<String, String> headers, RetryPolicy retry, boolean notifyProgress) {
  public WebhookConfig {
    if (url == null || url.isBlank()) throw new IllegalArgumentException("webhook url is required");
    URI uri = URI.create(url);
    if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
      throw new IllegalArgumentException("webhook url must be http or https: " + url);
    }
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  /**
   * Parse {@code {url, headers, maxAttempts, baseDelayMs, multiplier, maxDelayMs, notifyProgress}}.
   * Missing retry fields fall back to {@code defaults}.
   *
   * @throws IllegalArgumentException on missing url or invalid values
   */
  public static WebhookConfig fromJson(JsonNode node, RetryPolicy defaults) {
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("webhook must be a JSON object");
    }
    Map<String, String> headers = new LinkedHashMap<>();
    JsonNode h = node.path("headers");
    if (h.isObject()) {
      h.fields().forEachRemaining(e -> headers.put(e.getKey(), e.getValue().asText()));
    }
    RetryPolicy retry;
    try {
      retry =
          new RetryPolicy(
              node.path("maxAttempts").asInt(defaults.maxAttempts()),
              Duration.ofMillis(node.path("baseDelayMs").asLong(defaults.baseDelay().toMillis())),
              node.path("multiplier").asDouble(defaults.multiplier()),
              Duration.ofMillis(node.path("maxDelayMs").asLong(defaults.maxDelay().toMillis())));
    } catch (ConfigException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }
    return new WebhookConfig(
        node.path("url").asText(null),
        headers,
        retry,
        node.path("notifyProgress").asBoolean(false));
  }
}

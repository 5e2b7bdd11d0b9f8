package com.gentoro.infotransform.model;

import com.gentoro.infotransform.exception.ConfigException;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/** Builds the configured {@link InferenceClient} from the {@code llm} configuration subset. */
public final class InferenceClientFactory {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(InferenceClientFactory.class);

  private InferenceClientFactory() {}

  public static InferenceClient create(Configuration llm) {
    String provider = llm.getString("provider", "openai");
    if (!"openai".equalsIgnoreCase(provider)) {
      throw new ConfigException("Unsupported llm.provider: " + provider);
    }
    String apiKey = llm.getString("api-key", null);
    // An unset ${env:...} reference is left verbatim by the interpolator.
    if (apiKey == null || apiKey.isBlank() || apiKey.startsWith("${")) {
      throw new ConfigException("llm.api-key is required (set OPENAI_API_KEY)");
    }
    OpenAIOkHttpClient.Builder builder =
        OpenAIOkHttpClient.builder()
            .apiKey(apiKey)
            .timeout(Duration.ofSeconds(llm.getLong("timeout-seconds", 60)));
    String baseUrl = llm.getString("base-url", null);
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    OpenAIClient client = builder.build();
    String model = llm.getString("model", "gpt-4.1");
    log.info("Using OpenAI inference with model {}", model);
    return new OpenAiInferenceClient(client, model);
  }
}

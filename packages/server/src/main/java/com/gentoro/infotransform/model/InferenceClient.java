package com.gentoro.infotransform.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;

/**
 * Inference collaborator: extracts structured data from one markdown document.
 *
 * <p>Called once per item so that each result can be streamed as soon as it resolves. Failures
 * are reported by throwing; the scheduler converts them into failed results for that item only.
 */
public interface InferenceClient {

  /**
   * @param markdown converted document text
   * @param context schema, instructions and model selection
   * @param timeout upper bound for this call
   * @return structured result as a JSON object
   * @throws Exception on provider errors, malformed output or timeout
   */
  JsonNode analyze(String markdown, AnalysisContext context, Duration timeout) throws Exception;

  /**
   * Streaming variant. Implementations that can surface partial structures call {@code partial}
   * for intermediate states before returning the final result. The default delegates to {@link
   * #analyze}.
   */
  default JsonNode analyzeStreaming(
      String markdown, AnalysisContext context, Duration timeout, PartialListener partial)
      throws Exception {
    return analyze(markdown, context, timeout);
  }

  /** Receives intermediate structures produced while a streaming analysis is running. */
  @FunctionalInterface
  interface PartialListener {
    void onPartial(JsonNode partialResult);
  }
}

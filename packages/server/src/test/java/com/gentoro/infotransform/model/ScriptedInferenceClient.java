package com.gentoro.infotransform.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.infotransform.exception.InferenceException;
import com.gentoro.infotransform.utility.JacksonUtility;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double driven by the markdown it receives.
 *
 * <ul>
 *   <li>contains {@code FAIL}: throws {@link InferenceException}
 *   <li>contains {@code SLEEP=<ms>}: sleeps before answering
 *   <li>contains {@code PARTIAL}: emits one partial structure first
 * </ul>
 *
 * Otherwise answers {@code {"text": <markdown>}}.
 */
public class ScriptedInferenceClient implements InferenceClient {
  public final AtomicInteger calls = new AtomicInteger();
  public final AtomicInteger running = new AtomicInteger();
  public final AtomicInteger peak = new AtomicInteger();

  @Override
  public JsonNode analyze(String markdown, AnalysisContext context, Duration timeout)
      throws Exception {
    return analyzeStreaming(markdown, context, timeout, p -> {});
  }

  @Override
  public JsonNode analyzeStreaming(
      String markdown, AnalysisContext context, Duration timeout, PartialListener partial)
      throws Exception {
    calls.incrementAndGet();
    peak.accumulateAndGet(running.incrementAndGet(), Math::max);
    try {
      int sleepAt = markdown.indexOf("SLEEP=");
      if (sleepAt >= 0) {
        String digits = markdown.substring(sleepAt + 6).replaceAll("\\D.*$", "");
        Thread.sleep(Long.parseLong(digits));
      }
      if (markdown.contains("FAIL")) {
        throw new InferenceException("model rejected document");
      }
      if (markdown.contains("PARTIAL")) {
        ObjectNode draft = JacksonUtility.getJsonMapper().createObjectNode();
        draft.put("draft", true);
        partial.onPartial(draft);
      }
      ObjectNode out = JacksonUtility.getJsonMapper().createObjectNode();
      out.put("text", markdown.strip());
      return out;
    } finally {
      running.decrementAndGet();
    }
  }
}

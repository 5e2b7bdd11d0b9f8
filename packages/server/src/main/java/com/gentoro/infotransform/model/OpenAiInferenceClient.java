package com.gentoro.infotransform.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.infotransform.exception.ExceptionUtil;
import com.gentoro.infotransform.exception.InferenceException;
import com.gentoro.infotransform.utility.JacksonUtility;
import com.openai.client.OpenAIClient;
import com.openai.models.ChatModel;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;

/** {@link InferenceClient} backed by the openai-java SDK (Chat Completions API). */
public class OpenAiInferenceClient implements InferenceClient {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(OpenAiInferenceClient.class);

  private final OpenAIClient openAIClient;
  private final String defaultModel;

  public OpenAiInferenceClient(OpenAIClient openAIClient, String defaultModel) {
    this.openAIClient = openAIClient;
    this.defaultModel = defaultModel;
  }

  @Override
  public JsonNode analyze(String markdown, AnalysisContext context, Duration timeout)
      throws Exception {
    long start = System.currentTimeMillis();
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<String> future = executor.submit(() -> complete(markdown, context));
      String content;
      try {
        content = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        future.cancel(true);
        throw new InferenceException(
            "Inference timed out after " + timeout.toSeconds() + " seconds", e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Exception) {
          throw (Exception) cause;
        }
        throw new InferenceException("Inference failed: " + e.getMessage(), e);
      }
      return parse(content);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw e;
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          (ex) ->
              new InferenceException(
                  "There was a problem while running the inference with the chosen model.", ex));
    } finally {
      executor.shutdownNow();
      log.debug(
          "Inference for schema {} took {} ms",
          context.schemaKey(),
          System.currentTimeMillis() - start);
    }
  }

  private String complete(String markdown, AnalysisContext context) {
    String modelId = context.model() == null ? defaultModel : context.model();
    ChatCompletionCreateParams params =
        ChatCompletionCreateParams.builder()
            .model(ChatModel.of(modelId))
            .addSystemMessage(Prompts.system(context))
            .addUserMessage(markdown)
            .build();
    ChatCompletion completion = openAIClient.chat().completions().create(params);
    if (completion.choices().isEmpty()) {
      throw new InferenceException("No candidates returned from OpenAI inference.");
    }
    return completion.choices().stream()
        .filter(c -> c.message().content().isPresent())
        .map(c -> c.message().content().get())
        .findFirst()
        .orElseThrow(() -> new InferenceException("No content returned from OpenAI inference."));
  }

  static JsonNode parse(String content) {
    String text = Prompts.stripFences(content);
    JsonNode node;
    try {
      node = JacksonUtility.readTree(text);
    } catch (IllegalArgumentException e) {
      throw new InferenceException("Model returned malformed JSON", e);
    }
    if (node == null || !node.isObject()) {
      throw new InferenceException("Model did not return a JSON object");
    }
    return node;
  }
}

package com.gentoro.infotransform.webhook;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.infotransform.batch.BatchResult;
import com.gentoro.infotransform.http.OkHttpFactory;
import com.gentoro.infotransform.jobs.JobEvent;
import com.gentoro.infotransform.jobs.JobEventType;
import com.gentoro.infotransform.jobs.JobListener;
import com.gentoro.infotransform.jobs.JobView;
import com.gentoro.infotransform.utility.JacksonUtility;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.configuration2.Configuration;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/**
 * Delivers signed job events to caller-supplied URLs.
 *
 * <p>Each attempt is a POST carrying a fresh timestamp and a signature over that timestamp and the
 * body. A non-2xx response or a transport error fails the attempt; failed attempts are retried
 * with exponential backoff until the target's {@link RetryPolicy} runs out. Exhaustion is logged
 * and recorded but never reported back to the job.
 */
public final class WebhookDispatcher implements JobListener, AutoCloseable {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(WebhookDispatcher.class);

  public static final String SIGNATURE_HEADER = "X-InfoTransform-Signature";
  public static final String TIMESTAMP_HEADER = "X-InfoTransform-Timestamp";
  public static final String EVENT_HEADER = "X-InfoTransform-Event";
  public static final String DELIVERY_HEADER = "X-InfoTransform-Delivery";

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final int HISTORY_LIMIT = 500;

  private final OkHttpClient client;
  private final WebhookSigner signer;
  private final RetryPolicy defaultRetry;
  private final Clock clock;
  private final ScheduledExecutorService retries;

  private final Deque<WebhookAttempt> history = new ConcurrentLinkedDeque<>();
  private final LongAdder delivered = new LongAdder();
  private final LongAdder failedAttempts = new LongAdder();
  private final LongAdder exhausted = new LongAdder();

  /**
   * @param signer signs every request; {@code null} sends unsigned requests
   */
  public WebhookDispatcher(
      OkHttpClient client, WebhookSigner signer, RetryPolicy defaultRetry, Clock clock) {
    this.client = client;
    this.signer = signer;
    this.defaultRetry = defaultRetry;
    this.clock = clock;
    this.retries =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "webhook-retries");
              t.setDaemon(true);
              return t;
            });
  }

  public static WebhookDispatcher fromConfiguration(Configuration webhook) {
    String secret = webhook.getString("secret", "");
    WebhookSigner signer = null;
    if (secret == null || secret.isBlank() || secret.startsWith("${")) {
      log.warn("webhook.secret is not set; webhook requests will be unsigned");
    } else {
      signer = new WebhookSigner(secret);
    }
    OkHttpClient client =
        OkHttpFactory.create(
            Duration.ofSeconds(webhook.getLong("attempt-timeout-seconds", 10)), SIGNATURE_HEADER);
    return new WebhookDispatcher(
        client, signer, RetryPolicy.fromConfiguration(webhook), Clock.systemUTC());
  }

  public RetryPolicy defaultRetry() {
    return defaultRetry;
  }

  @Override
  public void onEvent(JobEvent event) {
    WebhookConfig target = event.webhook();
    if (target == null) return;
    if (event.type() == JobEventType.PROGRESS && !target.notifyProgress()) return;
    WebhookEventType type = WebhookEventType.of(event.type());
    notify(event.job().jobId(), target, type, payload(type, event, clock.instant()));
  }

  /**
   * Send one event. Returns immediately.
   *
   * @return completes with the final attempt, either DELIVERED or EXHAUSTED; never exceptionally
   */
  public CompletableFuture<WebhookAttempt> notify(
      String jobId, WebhookConfig target, WebhookEventType type, ObjectNode payload) {
    Delivery delivery =
        new Delivery(
            UUID.randomUUID().toString(),
            jobId,
            target,
            target.retry() == null ? defaultRetry : target.retry(),
            type,
            JacksonUtility.toJson(payload));
    delivery.attempt(1);
    return delivery.outcome;
  }

  static ObjectNode payload(WebhookEventType type, JobEvent event, Instant now) {
    ObjectNode root = JacksonUtility.getJsonMapper().createObjectNode();
    root.put("event", type.wireName());
    root.put("timestamp", now.toString());
    JobView job = event.job();
    ObjectNode j = root.putObject("job");
    j.put("id", job.jobId());
    j.put("status", job.status().name().toLowerCase());
    ObjectNode counts = j.putObject("counts");
    counts.put("total", job.totalCount());
    counts.put("completed", job.completedCount());
    counts.put("failed", job.failedCount());
    counts.put("skipped", job.skippedCount());
    counts.put("percent", job.percent());
    j.put("createdAt", job.createdAt().toString());
    if (job.startedAt() != null) j.put("startedAt", job.startedAt().toString());
    if (job.finishedAt() != null) j.put("finishedAt", job.finishedAt().toString());

    ObjectNode summary = root.putObject("resultSummary");
    BatchResult result = event.result();
    if (result != null) {
      summary.put("filename", result.filename());
      summary.put("success", result.success());
      if (result.error() != null) summary.put("error", result.error());
      summary.put("processingTimeMs", result.processingTimeMs());
    } else {
      summary.put("succeeded", job.completedCount());
      summary.put("failed", job.failedCount());
      summary.put("skipped", job.skippedCount());
      if (job.startedAt() != null && job.finishedAt() != null) {
        summary.put(
            "durationMs", Duration.between(job.startedAt(), job.finishedAt()).toMillis());
      }
      if (job.message() != null) summary.put("message", job.message());
    }
    return root;
  }

  public List<WebhookAttempt> attempts(String jobId) {
    return history.stream().filter(a -> a.jobId().equals(jobId)).toList();
  }

  public Stats stats() {
    return new Stats(delivered.sum(), failedAttempts.sum(), exhausted.sum());
  }

  @Override
  public void close() {
    retries.shutdownNow();
    client.dispatcher().executorService().shutdown();
  }

  private void record(WebhookAttempt attempt) {
    history.addLast(attempt);
    while (history.size() > HISTORY_LIMIT) history.pollFirst();
  }

  public record Stats(long delivered, long failedAttempts, long exhausted) {}

  private final class Delivery {
    private final String id;
    private final String jobId;
    private final WebhookConfig target;
    private final RetryPolicy retry;
    private final WebhookEventType type;
    private final String body;
    private final CompletableFuture<WebhookAttempt> outcome = new CompletableFuture<>();

    Delivery(
        String id,
        String jobId,
        WebhookConfig target,
        RetryPolicy retry,
        WebhookEventType type,
        String body) {
      this.id = id;
      this.jobId = jobId;
      this.target = target;
      this.retry = retry;
      this.type = type;
      this.body = body;
    }

    void attempt(int number) {
      Instant sentAt = clock.instant();
      long timestamp = sentAt.getEpochSecond();
      String signature = signer == null ? null : signer.sign(timestamp, body);

      Request.Builder rb =
          new Request.Builder().url(target.url()).post(RequestBody.create(body, JSON));
      target.headers().forEach(rb::header);
      rb.header(TIMESTAMP_HEADER, Long.toString(timestamp));
      rb.header(EVENT_HEADER, type.wireName());
      rb.header(DELIVERY_HEADER, id);
      if (signature != null) rb.header(SIGNATURE_HEADER, signature);

      Request request;
      try {
        request = rb.build();
      } catch (IllegalArgumentException e) {
        finish(number, 0, "Invalid request: " + e.getMessage(), signature, sentAt, false);
        return;
      }
      client
          .newCall(request)
          .enqueue(
              new Callback() {
                @Override
                public void onFailure(@NotNull Call call, @NotNull IOException e) {
                  String message =
                      e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                  finish(number, 0, message, signature, sentAt, true);
                }

                @Override
                public void onResponse(@NotNull Call call, @NotNull Response response) {
                  try (response) {
                    if (response.isSuccessful()) {
                      WebhookAttempt done =
                          new WebhookAttempt(
                              id,
                              jobId,
                              target.url(),
                              type,
                              number,
                              WebhookAttempt.Outcome.DELIVERED,
                              response.code(),
                              null,
                              signature,
                              sentAt,
                              null);
                      record(done);
                      delivered.increment();
                      log.debug(
                          "Webhook {} for job {} delivered on attempt {}",
                          type.wireName(),
                          jobId,
                          number);
                      outcome.complete(done);
                    } else {
                      finish(
                          number,
                          response.code(),
                          "HTTP " + response.code(),
                          signature,
                          sentAt,
                          true);
                    }
                  }
                }
              });
    }

    private void finish(
        int number, int status, String error, String signature, Instant sentAt, boolean retryable) {
      failedAttempts.increment();
      if (retryable && retry.hasAttemptAfter(number)) {
        Duration delay = retry.delayAfter(number);
        record(
            new WebhookAttempt(
                id,
                jobId,
                target.url(),
                type,
                number,
                WebhookAttempt.Outcome.FAILED,
                status,
                error,
                signature,
                sentAt,
                delay));
        log.warn(
            "Webhook {} for job {} failed (attempt {}/{}): {}; retrying in {}ms",
            type.wireName(),
            jobId,
            number,
            retry.maxAttempts(),
            error,
            delay.toMillis());
        try {
          retries.schedule(() -> attempt(number + 1), delay.toMillis(), TimeUnit.MILLISECONDS);
          return;
        } catch (RejectedExecutionException e) {
          log.warn("Webhook retries stopped; giving up on delivery {}", id);
        }
      }
      WebhookAttempt last =
          new WebhookAttempt(
              id,
              jobId,
              target.url(),
              type,
              number,
              WebhookAttempt.Outcome.EXHAUSTED,
              status,
              error,
              signature,
              sentAt,
              null);
      record(last);
      exhausted.increment();
      log.error(
          "Webhook {} for job {} to {} exhausted after {} attempt(s): {}",
          type.wireName(),
          jobId,
          target.url(),
          number,
          error);
      outcome.complete(last);
    }
  }
}

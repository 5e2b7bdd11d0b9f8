package com.gentoro.infotransform.http;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/**
 * Logs outbound request and response summaries at DEBUG (bodies at TRACE) and transport failures
 * at WARN. Signature headers are masked.
 */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private final String signatureHeader;

  public LoggingInterceptor(String signatureHeader) {
    this.signatureHeader = signatureHeader;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "➡️ Sending {} {}\nHeaders:\n{}", request.method(), request.url(), headers(request));
      log.trace("Request body:\n{}", bodyToString(request));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsed(startTime));
      throw e;
    } catch (ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsed(startTime),
          e.getMessage() == null ? "Could not connect to server" : e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsed(startTime),
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    log.debug(
        "⬅️ Received response for {} in {} ms, status {}",
        response.request().url(),
        elapsed(startTime),
        response.code());
    if (log.isTraceEnabled()) {
      try {
        log.trace("Response body:\n{}", response.peekBody(64 * 1024).string());
      } catch (IOException e) {
        log.trace("Could not read response body", e);
      }
    }
    return response;
  }

  private String headers(Request request) {
    StringBuilder sb = new StringBuilder();
    request
        .headers()
        .forEach(
            pair -> {
              String value =
                  pair.getFirst().equalsIgnoreCase(signatureHeader) ? "***" : pair.getSecond();
              sb.append(pair.getFirst()).append(": ").append(value).append('\n');
            });
    return sb.toString();
  }

  private static long elapsed(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}

package com.gentoro.infotransform.api.endpoints;

import com.gentoro.infotransform.pipeline.ResultBroadcaster;
import com.gentoro.infotransform.pipeline.StreamMessage;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import org.slf4j.Logger;

/** Writes a job's stream as {@code text/event-stream} until its {@code complete} message. */
final class EventStreamWriter {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(EventStreamWriter.class);

  private static final Duration KEEPALIVE = Duration.ofSeconds(15);

  private EventStreamWriter() {}

  static void stream(ResultBroadcaster.Subscription subscription, HttpServletResponse resp)
      throws IOException {
    resp.setStatus(200);
    resp.setContentType("text/event-stream");
    resp.setCharacterEncoding("UTF-8");
    resp.setHeader("Cache-Control", "no-cache");
    resp.setHeader("X-Accel-Buffering", "no");
    PrintWriter out = resp.getWriter();
    out.flush();
    try {
      while (!subscription.isDone()) {
        StreamMessage message = subscription.next(KEEPALIVE);
        out.write(message == null ? ": keepalive\n\n" : message.toSse());
        out.flush();
        if (out.checkError()) {
          log.debug("Client disconnected from event stream");
          return;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}

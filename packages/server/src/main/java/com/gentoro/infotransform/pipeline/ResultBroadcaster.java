package com.gentoro.infotransform.pipeline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Fans each job's stream messages out to any number of subscribers. A subscriber that attaches
 * late first receives everything published so far, then live messages, ending with {@code
 * complete}.
 */
public final class ResultBroadcaster {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(ResultBroadcaster.class);

  private final Map<String, Channel> channels = new ConcurrentHashMap<>();

  public void open(String jobId) {
    channels.putIfAbsent(jobId, new Channel());
  }

  public void publish(String jobId, StreamMessage message) {
    Channel channel = channels.get(jobId);
    if (channel == null) {
      log.debug("Dropping {} message for unknown stream {}", message.type(), jobId);
      return;
    }
    channel.publish(message);
  }

  /** @return empty if no stream exists for the job */
  public Optional<Subscription> subscribe(String jobId) {
    Channel channel = channels.get(jobId);
    return channel == null ? Optional.empty() : Optional.of(channel.subscribe());
  }

  public void remove(String jobId) {
    channels.remove(jobId);
  }

  /** Live view of one job's stream. */
  public static final class Subscription {
    private final BlockingQueue<StreamMessage> queue = new LinkedBlockingQueue<>();
    private volatile boolean done;

    /** @return the next message, or null if none arrived within {@code timeout} */
    public StreamMessage next(Duration timeout) throws InterruptedException {
      if (done && queue.isEmpty()) return null;
      StreamMessage m = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (m != null && m.isComplete()) done = true;
      return m;
    }

    /** {@code true} once the {@code complete} message has been taken. */
    public boolean isDone() {
      return done;
    }
  }

  private static final class Channel {
    private final List<StreamMessage> history = new ArrayList<>();
    private final List<Subscription> subscribers = new ArrayList<>();
    private boolean closed;

    synchronized void publish(StreamMessage message) {
      if (closed) return;
      history.add(message);
      for (Subscription s : subscribers) s.queue.add(message);
      if (message.isComplete()) {
        closed = true;
        subscribers.clear();
      }
    }

    synchronized Subscription subscribe() {
      Subscription s = new Subscription();
      s.queue.addAll(history);
      if (!closed) subscribers.add(s);
      return s;
    }
  }
}

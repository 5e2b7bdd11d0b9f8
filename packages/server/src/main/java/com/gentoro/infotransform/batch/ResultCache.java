package com.gentoro.infotransform.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.infotransform.exception.StateException;
import com.gentoro.infotransform.model.AnalysisContext;
import com.gentoro.infotransform.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * In-memory cache of structured results keyed by a SHA-256 of the markdown and the full analysis
 * context: schema key, schema body, instructions and model. Callers supply their own schema, so
 * the schema key alone does not identify the extraction.
 *
 * <p>Entries expire after the configured TTL. When the cache is full the least recently read entry
 * is evicted. A disabled cache never stores anything.
 */
public final class ResultCache {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(ResultCache.class);

  private final boolean enabled;
  private final Duration ttl;
  private final int maxEntries;
  private final Clock clock;
  private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);

  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();
  private final LongAdder sets = new LongAdder();
  private final LongAdder evictions = new LongAdder();

  public ResultCache(boolean enabled, Duration ttl, int maxEntries, Clock clock) {
    this.enabled = enabled;
    this.ttl = ttl;
    this.maxEntries = Math.max(1, maxEntries);
    this.clock = clock;
    if (enabled) {
      log.info("Result cache initialized: TTL={}h, max entries={}", ttl.toHours(), this.maxEntries);
    } else {
      log.info("Result cache is disabled");
    }
  }

  public static ResultCache disabled() {
    return new ResultCache(false, Duration.ZERO, 1, Clock.systemUTC());
  }

  public static ResultCache fromConfiguration(Configuration cache) {
    return new ResultCache(
        cache.getBoolean("enabled", true),
        Duration.ofHours(cache.getLong("ttl-hours", 24)),
        cache.getInt("max-entries", 10000),
        Clock.systemUTC());
  }

  public Optional<JsonNode> get(String markdown, AnalysisContext context) {
    if (!enabled) return Optional.empty();
    String key = key(markdown, context);
    synchronized (entries) {
      Entry entry = entries.get(key);
      if (entry != null && entry.expiresAt.isAfter(clock.instant())) {
        hits.increment();
        log.debug("Cache hit for {}", key.substring(0, 12));
        return Optional.of(entry.value.deepCopy());
      }
      if (entry != null) {
        entries.remove(key);
        evictions.increment();
      }
    }
    misses.increment();
    return Optional.empty();
  }

  public void put(String markdown, AnalysisContext context, JsonNode value) {
    if (!enabled || value == null) return;
    String key = key(markdown, context);
    synchronized (entries) {
      entries.put(key, new Entry(value.deepCopy(), clock.instant().plus(ttl)));
      sets.increment();
      evictOverflow();
    }
  }

  /** Drop expired entries. Returns the number removed. */
  public int purgeExpired() {
    Instant now = clock.instant();
    int removed = 0;
    synchronized (entries) {
      Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
      while (it.hasNext()) {
        if (!it.next().getValue().expiresAt.isAfter(now)) {
          it.remove();
          removed++;
        }
      }
    }
    evictions.add(removed);
    return removed;
  }

  public boolean enabled() {
    return enabled;
  }

  public Stats stats() {
    long h = hits.sum();
    long m = misses.sum();
    int size;
    synchronized (entries) {
      size = entries.size();
    }
    return new Stats(
        enabled, size, h, m, sets.sum(), evictions.sum(), h + m == 0 ? 0.0 : (double) h / (h + m));
  }

  private void evictOverflow() {
    Iterator<String> it = entries.keySet().iterator();
    while (entries.size() > maxEntries && it.hasNext()) {
      it.next();
      it.remove();
      evictions.increment();
    }
  }

  static String key(String markdown, AnalysisContext context) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      // NUL-separated so adjacent fields cannot run into each other.
      for (String part :
          new String[] {
            markdown,
            context.schemaKey(),
            JacksonUtility.toJson(context.schema()),
            context.instructions(),
            String.valueOf(context.model())
          }) {
        md.update(part.getBytes(StandardCharsets.UTF_8));
        md.update((byte) 0);
      }
      StringBuilder sb = new StringBuilder();
      for (byte b : md.digest()) sb.append(String.format("%02x", b));
      return sb.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new StateException("SHA-256 not available", e);
    }
  }

  private record Entry(JsonNode value, Instant expiresAt) {}

  public record Stats(
      boolean enabled,
      int entries,
      long hits,
      long misses,
      long sets,
      long evictions,
      double hitRate) {}
}

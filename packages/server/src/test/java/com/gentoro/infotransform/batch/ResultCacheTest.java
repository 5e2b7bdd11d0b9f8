package com.gentoro.infotransform.batch;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.infotransform.model.AnalysisContext;
import com.gentoro.infotransform.utility.JacksonUtility;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ResultCacheTest {

  static final class StepClock extends Clock {
    Instant now = Instant.parse("2025-01-01T00:00:00Z");

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  private static ObjectNode value(String v) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("v", v);
    return node;
  }

  private static final AnalysisContext K = context("k", "{}", null, null);

  private static AnalysisContext context(
      String schemaKey, String schema, String instructions, String model) {
    return new AnalysisContext(schemaKey, JacksonUtility.readTree(schema), instructions, model);
  }

  @Test
  void hitAfterPutAndMissOnDifferentContext() {
    ResultCache cache = new ResultCache(true, Duration.ofHours(1), 10, Clock.systemUTC());
    AnalysisContext invoice = context("invoice", "{\"total\":{}}", null, "gpt");
    cache.put("# doc", invoice, value("a"));

    assertEquals("a", cache.get("# doc", invoice).orElseThrow().path("v").asText());
    assertTrue(cache.get("# doc", context("receipt", "{\"total\":{}}", null, "gpt")).isEmpty());
    assertTrue(cache.get("# doc", context("invoice", "{\"total\":{}}", null, "o")).isEmpty());

    ResultCache.Stats stats = cache.stats();
    assertEquals(1, stats.hits());
    assertEquals(2, stats.misses());
    assertEquals(1, stats.sets());
  }

  @Test
  void defaultSchemaKeyDoesNotShareEntriesAcrossSchemas() {
    ResultCache cache = new ResultCache(true, Duration.ofHours(1), 10, Clock.systemUTC());
    AnalysisContext totals = context(null, "{\"total\":{\"type\":\"number\"}}", null, null);
    AnalysisContext names = context(null, "{\"name\":{\"type\":\"string\"}}", null, null);
    assertEquals(totals.schemaKey(), names.schemaKey());

    cache.put("same document", totals, value("totals"));

    assertTrue(cache.get("same document", names).isEmpty());
    assertTrue(cache.get("same document", context(null, "{}", "Only dates", null)).isEmpty());
    assertEquals(
        "totals", cache.get("same document", totals).orElseThrow().path("v").asText());
  }

  @Test
  void returnedValuesAreCopies() {
    ResultCache cache = new ResultCache(true, Duration.ofHours(1), 10, Clock.systemUTC());
    cache.put("# doc", K, value("a"));
    ((ObjectNode) cache.get("# doc", K).orElseThrow()).put("v", "mutated");
    assertEquals("a", cache.get("# doc", K).orElseThrow().path("v").asText());
  }

  @Test
  void entriesExpire() {
    StepClock clock = new StepClock();
    ResultCache cache = new ResultCache(true, Duration.ofHours(24), 10, clock);
    cache.put("one", K, value("1"));
    cache.put("two", K, value("2"));
    clock.now = clock.now.plus(Duration.ofHours(25));

    assertTrue(cache.get("one", K).isEmpty());
    assertEquals(1, cache.purgeExpired());
    assertEquals(0, cache.stats().entries());
  }

  @Test
  void leastRecentlyReadEntryIsEvicted() {
    ResultCache cache = new ResultCache(true, Duration.ofHours(1), 2, Clock.systemUTC());
    cache.put("a", K, value("a"));
    cache.put("b", K, value("b"));
    cache.get("a", K);
    cache.put("c", K, value("c"));

    assertTrue(cache.get("a", K).isPresent());
    assertTrue(cache.get("b", K).isEmpty());
    assertTrue(cache.get("c", K).isPresent());
    assertEquals(1, cache.stats().evictions());
  }

  @Test
  void disabledCacheStoresNothing() {
    ResultCache cache = ResultCache.disabled();
    cache.put("a", K, value("a"));
    Optional<JsonNode> hit = cache.get("a", K);
    assertTrue(hit.isEmpty());
    assertEquals(0, cache.stats().entries());
  }

  @Test
  void keyIsStableHex() {
    AnalysisContext withModel = context("schema", "{}", null, "model");
    String k = ResultCache.key("doc", withModel);
    assertEquals(64, k.length());
    assertEquals(k, ResultCache.key("doc", context("schema", "{}", null, "model")));
    assertNotEquals(k, ResultCache.key("doc", context("schema", "{}", null, null)));
    assertNotEquals(
        ResultCache.key("ab", context("c", "{}", null, null)),
        ResultCache.key("a", context("bc", "{}", null, null)));
  }
}

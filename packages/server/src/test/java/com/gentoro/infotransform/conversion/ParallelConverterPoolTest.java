package com.gentoro.infotransform.conversion;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.infotransform.batch.BatchItem;
import com.gentoro.infotransform.files.ManagedFile;
import com.gentoro.infotransform.files.ManagedFileStore;
import com.gentoro.infotransform.jobs.CancelChecker;
import com.gentoro.infotransform.model.AnalysisContext;
import com.gentoro.infotransform.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

class ParallelConverterPoolTest {

  @TempDir Path root;

  private ManagedFileStore store;
  private ParallelConverterPool pool;
  private final AnalysisContext context =
      new AnalysisContext("invoice", JacksonUtility.getJsonMapper().createObjectNode(), null, null);

  /** Echoes the content, sleeping when asked to via a "sleep:<ms>" prefix. */
  static final class ScriptedConverter implements DocumentConverter {
    final AtomicInteger running = new AtomicInteger();
    final AtomicInteger peak = new AtomicInteger();
    final AtomicInteger interrupted = new AtomicInteger();

    @Override
    public boolean supports(String filename, String mediaType) {
      return true;
    }

    @Override
    public String convert(byte[] content, String typeHint, Duration timeout) throws Exception {
      int now = running.incrementAndGet();
      peak.accumulateAndGet(now, Math::max);
      try {
        String text = new String(content, StandardCharsets.UTF_8);
        if (text.startsWith("sleep:")) {
          try {
            Thread.sleep(Long.parseLong(text.substring(6).trim()));
          } catch (InterruptedException e) {
            interrupted.incrementAndGet();
            throw e;
          }
        }
        if (text.startsWith("fail")) throw new IllegalStateException("broken file");
        if (text.startsWith("empty")) return " ";
        return "# " + text;
      } finally {
        running.decrementAndGet();
      }
    }
  }

  @BeforeEach
  void setUp() {
    store =
        new ManagedFileStore(
            root, Duration.ofMinutes(5), Duration.ofSeconds(10), Clock.systemUTC());
  }

  @AfterEach
  void tearDown() {
    if (pool != null) pool.close();
    store.close();
  }

  private List<ManagedFile> register(String... contents) {
    List<ManagedFile> files = new ArrayList<>();
    for (int i = 0; i < contents.length; i++) {
      byte[] bytes = contents[i].getBytes(StandardCharsets.UTF_8);
      files.add(store.register("batch", "file" + i + ".txt", "text/plain", bytes));
    }
    return files;
  }

  @Test
  @Timeout(10)
  @DisplayName("one slow file times out while the other six convert")
  void slowFileTimesOutIndependently() throws Exception {
    ScriptedConverter converter = new ScriptedConverter();
    pool =
        new ParallelConverterPool(converter, store, 4, WorkerType.IO, Duration.ofMillis(300), 10);
    List<ManagedFile> files = register("a", "b", "sleep:5000", "c", "d", "e", "f");
    List<BatchItem> items = Collections.synchronizedList(new ArrayList<>());

    pool.convertAll("job-1", files, context, CancelChecker.NEVER, items::add)
        .get(5, TimeUnit.SECONDS);

    assertEquals(7, items.size());
    assertEquals(6, items.stream().filter(BatchItem::isConverted).count());
    BatchItem slow =
        items.stream().filter(i -> i.fileId().equals(files.get(2).id())).findFirst().orElseThrow();
    assertFalse(slow.isConverted());
    assertTrue(slow.error().startsWith("Timeout after"), slow.error());
    assertEquals(1, pool.metrics().timedOut());
    assertEquals(6, pool.metrics().successful());
  }

  @Test
  @Timeout(10)
  @DisplayName("items arrive in completion order, not submission order")
  void completionOrder() throws Exception {
    pool =
        new ParallelConverterPool(
            new ScriptedConverter(), store, 3, WorkerType.IO, Duration.ofSeconds(5), 10);
    List<ManagedFile> files = register("sleep:600", "sleep:300", "x");
    List<String> order = Collections.synchronizedList(new ArrayList<>());

    pool.convertAll("job-1", files, context, CancelChecker.NEVER, i -> order.add(i.fileId()))
        .get(5, TimeUnit.SECONDS);

    assertEquals(List.of(files.get(2).id(), files.get(1).id(), files.get(0).id()), order);
  }

  @Test
  @Timeout(10)
  @DisplayName("converter errors and empty output become failed items")
  void failuresAreIsolated() throws Exception {
    pool =
        new ParallelConverterPool(
            new ScriptedConverter(), store, 2, WorkerType.IO, Duration.ofSeconds(5), 10);
    List<ManagedFile> files = register("ok", "fail", "empty");
    List<BatchItem> items = Collections.synchronizedList(new ArrayList<>());

    pool.convertAll("job-1", files, context, CancelChecker.NEVER, items::add)
        .get(5, TimeUnit.SECONDS);

    assertEquals(1, items.stream().filter(BatchItem::isConverted).count());
    assertTrue(
        items.stream().anyMatch(i -> "IllegalStateException: broken file".equals(i.error())));
    assertTrue(items.stream().anyMatch(i -> "No content extracted".equals(i.error())));
    // The pool drops its own read reference after each conversion.
    assertEquals(0, store.stats().activeReferences());
  }

  @Test
  @Timeout(10)
  @DisplayName("never runs more conversions than workers and blocks the submitter when full")
  void boundedConcurrencyAndBackpressure() throws Exception {
    ScriptedConverter converter = new ScriptedConverter();
    pool = new ParallelConverterPool(converter, store, 2, WorkerType.IO, Duration.ofSeconds(5), 1);
    List<ManagedFile> files =
        register("sleep:200", "sleep:200", "sleep:200", "sleep:200", "sleep:200", "sleep:200");
    long started = System.nanoTime();

    var done = pool.convertAll("job-1", files, context, CancelChecker.NEVER, i -> {});
    long submitMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
    done.get(5, TimeUnit.SECONDS);

    assertTrue(converter.peak.get() <= 2, "peak " + converter.peak.get());
    // Two running plus one queued: submitting six files must have waited for at least one slot.
    assertTrue(submitMillis >= 150, "submission returned after " + submitMillis + "ms");
  }

  @Test
  @Timeout(10)
  @DisplayName("files of a cancelled job are skipped before conversion")
  void cancelledJobIsSkipped() throws Exception {
    ScriptedConverter converter = new ScriptedConverter();
    pool = new ParallelConverterPool(converter, store, 2, WorkerType.IO, Duration.ofSeconds(5), 10);
    List<BatchItem> items = Collections.synchronizedList(new ArrayList<>());

    pool.convertAll("job-1", register("a", "b"), context, jobId -> true, items::add)
        .get(5, TimeUnit.SECONDS);

    assertEquals(2, items.size());
    assertTrue(items.stream().allMatch(BatchItem::skipped));
    assertEquals(0, converter.peak.get());
  }

  @Test
  void cpuWorkersAreCappedByProcessors() {
    assertTrue(WorkerType.CPU.threads(10_000) <= Runtime.getRuntime().availableProcessors());
    assertEquals(7, WorkerType.IO.threads(7));
    assertEquals(WorkerType.CPU, WorkerType.parse("process"));
    assertThrows(
        com.gentoro.infotransform.exception.ConfigException.class, () -> WorkerType.parse("gpu"));
  }
}

package com.gentoro.infotransform.jobs;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.infotransform.batch.BatchResult;
import com.gentoro.infotransform.exception.JobNotFoundException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JobTrackerTest {

  static final class StepClock extends Clock {
    volatile Instant now = Instant.parse("2025-01-01T00:00:00Z");

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

  private final StepClock clock = new StepClock();
  private final JobTracker tracker =
      new JobTracker(new InMemoryJobStore(), Duration.ofHours(1), Duration.ofMinutes(1), clock);

  private static BatchResult ok(String jobId, String fileId) {
    return new BatchResult(jobId, fileId, fileId + ".txt", true, null, null, 5, true, false, false);
  }

  private static BatchResult failed(String jobId, String fileId) {
    return new BatchResult(
        jobId, fileId, fileId + ".txt", false, null, "boom", 5, true, false, false);
  }

  private static BatchResult skipped(String jobId, String fileId) {
    return new BatchResult(
        jobId, fileId, fileId + ".txt", false, null, "Cancelled", 0, true, false, true);
  }

  @Test
  @DisplayName("6 successes and 1 failure complete the job with exact counts")
  void completesWithPartialFailure() {
    List<String> files = List.of("f1", "f2", "f3", "f4", "f5", "f6", "f7");
    String id = tracker.submit("batch", files, null);
    assertEquals(JobStatus.QUEUED, tracker.status(id).status());

    tracker.markProcessing(id);
    for (String f : files) {
      tracker.record(id, f.equals("f3") ? failed(id, f) : ok(id, f));
    }

    JobView view = tracker.status(id);
    assertEquals(JobStatus.COMPLETED, view.status());
    assertEquals(7, view.totalCount());
    assertEquals(6, view.completedCount());
    assertEquals(1, view.failedCount());
    assertEquals(100, view.percent());
    assertNotNull(view.finishedAt());
  }

  @Test
  void statusIsIdempotentWithoutNewResults() {
    String id = tracker.submit("batch", List.of("a", "b"), null);
    tracker.markProcessing(id);
    tracker.record(id, ok(id, "a"));
    assertEquals(tracker.status(id), tracker.status(id));
  }

  @Test
  @DisplayName("duplicate, partial and foreign results are ignored")
  void ignoresDuplicatesAndUnknownFiles() {
    String id = tracker.submit("batch", List.of("a", "b"), null);
    tracker.markProcessing(id);

    assertTrue(tracker.record(id, ok(id, "a")));
    assertFalse(tracker.record(id, failed(id, "a")));
    assertFalse(tracker.record(id, ok(id, "zzz")));
    assertFalse(
        tracker.record(
            id, new BatchResult(id, "b", "b.txt", true, null, null, 1, false, false, false)));

    JobView view = tracker.status(id);
    assertEquals(1, view.completedCount());
    assertEquals(0, view.failedCount());
    assertEquals(JobStatus.PROCESSING, view.status());
  }

  @Test
  @DisplayName("cancel lets in-flight work finish and ends CANCELLED once all files are accounted")
  void cancelEndsCancelled() {
    String id = tracker.submit("batch", List.of("a", "b", "c"), null);
    tracker.markProcessing(id);
    tracker.record(id, ok(id, "a"));

    assertTrue(tracker.cancel(id));
    assertTrue(tracker.isCancelled(id));
    assertTrue(tracker.cancel(id));
    assertEquals(JobStatus.PROCESSING, tracker.status(id).status());

    tracker.record(id, ok(id, "b"));
    tracker.record(id, skipped(id, "c"));
    JobView view = tracker.status(id);
    assertEquals(JobStatus.CANCELLED, view.status());
    assertEquals(2, view.completedCount());
    assertEquals(1, view.skippedCount());
  }

  @Test
  void cancelUnknownJobReturnsFalse() {
    assertFalse(tracker.cancel("missing"));
    assertFalse(tracker.isCancelled("missing"));
  }

  @Test
  void emptyJobCompletesImmediately() {
    String id = tracker.submit("batch", List.of(), null);
    tracker.markProcessing(id);
    assertEquals(JobStatus.COMPLETED, tracker.status(id).status());
  }

  @Test
  @DisplayName("terminal jobs are purged after retention and then read as not found")
  void purgeAfterRetention() {
    List<String> purged = new ArrayList<>();
    tracker.onPurge(purged::add);
    String done = tracker.submit("batch", List.of("a"), null);
    tracker.markProcessing(done);
    tracker.record(done, ok(done, "a"));
    String running = tracker.submit("batch2", List.of("a"), null);
    tracker.markProcessing(running);

    clock.now = clock.now.plus(Duration.ofMinutes(59));
    assertEquals(0, tracker.purgeExpired());
    clock.now = clock.now.plus(Duration.ofMinutes(2));
    assertEquals(1, tracker.purgeExpired());

    assertThrows(JobNotFoundException.class, () -> tracker.status(done));
    assertTrue(tracker.view(done).isEmpty());
    assertEquals(List.of(done), purged);
    assertEquals(JobStatus.PROCESSING, tracker.status(running).status());
  }

  @Test
  void failedJobIsTerminal() {
    String id = tracker.submit("batch", List.of("a"), null);
    tracker.markProcessing(id);
    tracker.markFailed(id, "converter pool crashed");
    assertFalse(tracker.record(id, ok(id, "a")));
    JobView view = tracker.status(id);
    assertEquals(JobStatus.FAILED, view.status());
    assertEquals("converter pool crashed", view.message());
  }

  @Test
  @DisplayName("listeners see STARTED, one PROGRESS per file, then exactly one terminal event")
  void listenerEventOrder() {
    List<JobEvent> events = new CopyOnWriteArrayList<>();
    tracker.addListener(events::add);
    tracker.addListener(
        e -> {
          throw new IllegalStateException("listener bug");
        });
    String id = tracker.submit("batch", List.of("a", "b"), null);
    tracker.markProcessing(id);
    tracker.record(id, ok(id, "a"));
    tracker.record(id, failed(id, "b"));

    assertEquals(
        List.of(
            JobEventType.STARTED,
            JobEventType.PROGRESS,
            JobEventType.PROGRESS,
            JobEventType.COMPLETED),
        events.stream().map(JobEvent::type).toList());
    assertEquals(2, events.get(3).job().processedCount());
  }

  @Test
  @DisplayName("concurrent recording never loses an update")
  void concurrentRecording() throws Exception {
    List<String> files = new ArrayList<>();
    for (int i = 0; i < 400; i++) files.add("f" + i);
    String id = tracker.submit("batch", files, null);
    tracker.markProcessing(id);

    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Integer> observed = new CopyOnWriteArrayList<>();
    for (int i = 0; i < files.size(); i++) {
      String f = files.get(i);
      boolean success = i % 4 != 0;
      pool.execute(
          () -> {
            try {
              start.await();
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
              return;
            }
            tracker.record(id, success ? ok(id, f) : failed(id, f));
            JobView v = tracker.status(id);
            observed.add(v.processedCount());
            assertTrue(v.completedCount() + v.failedCount() <= v.totalCount());
          });
    }
    start.countDown();
    pool.shutdown();
    assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

    JobView view = tracker.status(id);
    assertEquals(JobStatus.COMPLETED, view.status());
    assertEquals(300, view.completedCount());
    assertEquals(100, view.failedCount());
    assertTrue(observed.stream().allMatch(n -> n >= 1 && n <= 400));
  }
}

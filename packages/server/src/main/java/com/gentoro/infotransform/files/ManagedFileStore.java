package com.gentoro.infotransform.files;

import com.gentoro.infotransform.exception.ConfigException;
import com.gentoro.infotransform.exception.FileStoreException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Owns the bytes of uploaded files and decides when they may be deleted.
 *
 * <p>Every reader must {@link #acquire(String)} a file before touching its bytes and {@link
 * #release(String)} it afterwards. A background sweep deletes a file only when its reference count
 * is zero and either its retention deadline (registration time plus {@code max-retention}) has
 * passed or {@link #markStreamComplete(String)} was called for its batch. Deletion errors are
 * logged and retried on the next sweep; they are never reported to callers.
 *
 * <p>Configuration keys (under {@code files}):
 *
 * <ul>
 *   <li>{@code upload-dir} (default: {@code <java.io.tmpdir>/infotransform-uploads})
 *   <li>{@code max-retention-seconds} (default 300)
 *   <li>{@code cleanup-interval-seconds} (default 10)
 * </ul>
 */
public final class ManagedFileStore implements AutoCloseable {
  private static final Logger log =
      com.gentoro.infotransform.logging.LoggingService.getLogger(ManagedFileStore.class);

  private final Path root;
  private final Duration maxRetention;
  private final Duration sweepInterval;
  private final Clock clock;

  private final Map<String, ManagedFile> files = new ConcurrentHashMap<>();
  private final Set<String> completedBatches = ConcurrentHashMap.newKeySet();
  private final AtomicLong deletedCount = new AtomicLong();
  private final AtomicLong deleteFailureCount = new AtomicLong();

  private final Object lifecycleLock = new Object();
  private ScheduledExecutorService sweeper;

  public ManagedFileStore(Path root, Duration maxRetention, Duration sweepInterval, Clock clock) {
    if (maxRetention.isNegative()) {
      throw new ConfigException("files.max-retention-seconds must not be negative");
    }
    if (sweepInterval.isZero() || sweepInterval.isNegative()) {
      throw new ConfigException("files.cleanup-interval-seconds must be positive");
    }
    this.root = root;
    this.maxRetention = maxRetention;
    this.sweepInterval = sweepInterval;
    this.clock = clock;
    try {
      Files.createDirectories(root);
    } catch (IOException e) {
      throw new FileStoreException("Unable to create upload directory " + root, e);
    }
  }

  public static ManagedFileStore fromConfiguration(Configuration files) {
    String dir =
        files.getString(
            "upload-dir",
            Path.of(System.getProperty("java.io.tmpdir"), "infotransform-uploads").toString());
    return new ManagedFileStore(
        Path.of(dir),
        Duration.ofSeconds(files.getLong("max-retention-seconds", 300)),
        Duration.ofSeconds(files.getLong("cleanup-interval-seconds", 10)),
        Clock.systemUTC());
  }

  /** Start the periodic cleanup sweep. Idempotent. */
  public void start() {
    synchronized (lifecycleLock) {
      if (sweeper != null) return;
      sweeper =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "file-store-sweeper");
                t.setDaemon(true);
                return t;
              });
      long millis = sweepInterval.toMillis();
      sweeper.scheduleWithFixedDelay(this::sweepSafely, millis, millis, TimeUnit.MILLISECONDS);
      log.info(
          "ManagedFileStore started at {} (retention {}s, sweep every {}ms)",
          root,
          maxRetention.toSeconds(),
          millis);
    }
  }

  /** Copy {@code content} into the store and start tracking it under {@code batchId}. */
  public ManagedFile register(
      String batchId, String filename, String mediaType, InputStream content) {
    String id = UUID.randomUUID().toString();
    Path dir = root.resolve(batchId);
    Path target = dir.resolve(id + "-" + safeName(filename));
    long size;
    try {
      Files.createDirectories(dir);
      size = Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new FileStoreException("Failed to store upload " + filename, e);
    }
    Instant now = clock.instant();
    ManagedFile file =
        new ManagedFile(
            id, batchId, filename, mediaType, size, target, now, now.plus(maxRetention));
    files.put(id, file);
    log.debug("Registered {} ({} bytes) as {}", filename, size, id);
    return file;
  }

  public ManagedFile register(String batchId, String filename, String mediaType, byte[] content) {
    return register(batchId, filename, mediaType, new java.io.ByteArrayInputStream(content));
  }

  public Optional<ManagedFile> find(String fileId) {
    return Optional.ofNullable(files.get(fileId));
  }

  /**
   * Take a reference on a file. Must precede any read of its bytes.
   *
   * @throws FileStoreException if the file is unknown or already deleted
   */
  public ManagedFile acquire(String fileId) {
    ManagedFile file = files.get(fileId);
    if (file == null || !file.retain()) {
      throw new FileStoreException("File " + fileId + " is not available");
    }
    log.trace("Acquired {}, refs: {}", fileId, file.refCount());
    return file;
  }

  /** Drop a reference taken by {@link #acquire(String)}. Unknown ids are ignored with a warning. */
  public void release(String fileId) {
    ManagedFile file = files.get(fileId);
    if (file == null) {
      log.warn("Attempting to release untracked file: {}", fileId);
      return;
    }
    int remaining = file.drop();
    if (remaining < 0) {
      log.warn("Release without matching acquire for {}", fileId);
    } else {
      log.trace("Released {}, refs: {}", fileId, remaining);
    }
  }

  /** Read the full contents of an acquired file. */
  public byte[] readBytes(ManagedFile file) throws IOException {
    if (file.refCount() == 0) {
      throw new FileStoreException("File " + file.id() + " read without an active reference");
    }
    return Files.readAllBytes(file.path());
  }

  /**
   * Signal that every file of {@code batchId} has finished its terminal consumption. Idempotent;
   * the next sweep deletes those files whose reference count is zero.
   */
  public void markStreamComplete(String batchId) {
    if (completedBatches.add(batchId)) {
      log.debug("Stream complete for batch {}", batchId);
    }
  }

  /**
   * Delete every eligible file. Per-file failures are logged and left for the next sweep.
   *
   * @return number of files deleted by this sweep
   */
  public int sweep() {
    Instant now = clock.instant();
    int deleted = 0;
    for (ManagedFile file : new ArrayList<>(files.values())) {
      if (deleteIfEligible(file, now)) {
        deleted++;
      }
    }
    pruneCompletedBatches();
    if (deleted > 0) {
      log.info("Cleaned up {} file(s)", deleted);
    }
    return deleted;
  }

  private boolean deleteIfEligible(ManagedFile file, Instant now) {
    synchronized (file) {
      if (!file.isDeletable(now, completedBatches.contains(file.batchId()))) {
        return false;
      }
      try {
        Files.deleteIfExists(file.path());
      } catch (IOException | SecurityException e) {
        file.recordDeleteFailure();
        deleteFailureCount.incrementAndGet();
        log.warn("Error cleaning up file {}: {}", file.path(), e.toString());
        return false;
      }
      file.markDeleted();
      files.remove(file.id());
    }
    deletedCount.incrementAndGet();
    log.debug("Deleted {} ({})", file.filename(), file.id());
    return true;
  }

  private void pruneCompletedBatches() {
    Set<String> live = ConcurrentHashMap.newKeySet();
    files.values().forEach(f -> live.add(f.batchId()));
    for (String batchId : new ArrayList<>(completedBatches)) {
      if (live.contains(batchId)) continue;
      completedBatches.remove(batchId);
      try {
        Files.deleteIfExists(root.resolve(batchId));
      } catch (DirectoryNotEmptyException e) {
        log.debug("Batch directory {} still has content", batchId);
      } catch (IOException e) {
        log.warn("Could not remove batch directory {}: {}", batchId, e.toString());
      }
    }
  }

  private void sweepSafely() {
    try {
      sweep();
    } catch (RuntimeException e) {
      log.error("Error in cleanup sweep", e);
    }
  }

  public FileStoreStats stats() {
    Instant now = clock.instant();
    int refs = 0;
    int pending = 0;
    long oldest = 0;
    for (ManagedFile f : files.values()) {
      int count = f.refCount();
      refs += count;
      if (count == 0 && completedBatches.contains(f.batchId())) pending++;
      oldest = Math.max(oldest, Duration.between(f.registeredAt(), now).toSeconds());
    }
    return new FileStoreStats(
        files.size(), refs, pending, deletedCount.get(), deleteFailureCount.get(), oldest);
  }

  public Path root() {
    return root;
  }

  @Override
  public void close() {
    synchronized (lifecycleLock) {
      if (sweeper != null) {
        sweeper.shutdownNow();
        sweeper = null;
        log.info("ManagedFileStore stopped");
      }
    }
  }

  private static String safeName(String filename) {
    if (filename == null || filename.isBlank()) return "upload";
    return filename.replaceAll("[^a-zA-Z0-9_.-]", "_");
  }
}

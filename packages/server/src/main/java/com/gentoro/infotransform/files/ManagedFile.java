package com.gentoro.infotransform.files;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A temporary artifact owned by {@link ManagedFileStore}.
 *
 * <p>Identity and storage attributes are immutable. The reference count and lifecycle state are
 * guarded by this object's monitor and only mutated by the store.
 */
public final class ManagedFile {
  private final String id;
  private final String batchId;
  private final String filename;
  private final String mediaType;
  private final long size;
  private final Path path;
  private final Instant registeredAt;
  private final Instant retentionDeadline;

  // guarded by this
  private int refCount;
  private ManagedFileState state = ManagedFileState.REGISTERED;
  private int deleteFailures;

  ManagedFile(
      String id,
      String batchId,
      String filename,
      String mediaType,
      long size,
      Path path,
      Instant registeredAt,
      Instant retentionDeadline) {
    this.id = id;
    this.batchId = batchId;
    this.filename = filename;
    this.mediaType = mediaType;
    this.size = size;
    this.path = path;
    this.registeredAt = registeredAt;
    this.retentionDeadline = retentionDeadline;
  }

  public String id() {
    return id;
  }

  public String batchId() {
    return batchId;
  }

  public String filename() {
    return filename;
  }

  public String mediaType() {
    return mediaType;
  }

  public long size() {
    return size;
  }

  public Path path() {
    return path;
  }

  public Instant registeredAt() {
    return registeredAt;
  }

  public Instant retentionDeadline() {
    return retentionDeadline;
  }

  public synchronized int refCount() {
    return refCount;
  }

  public synchronized ManagedFileState state() {
    return state;
  }

  synchronized int deleteFailures() {
    return deleteFailures;
  }

  /** Returns false when the file is already gone. */
  synchronized boolean retain() {
    if (state == ManagedFileState.DELETED) return false;
    refCount++;
    state = ManagedFileState.IN_USE;
    return true;
  }

  /** Returns the remaining count, or -1 if there was no reference to drop. */
  synchronized int drop() {
    if (refCount == 0) return -1;
    refCount--;
    if (refCount == 0) state = ManagedFileState.RELEASED;
    return refCount;
  }

  synchronized boolean isDeletable(Instant now, boolean streamComplete) {
    return state != ManagedFileState.DELETED
        && refCount == 0
        && (streamComplete || !now.isBefore(retentionDeadline));
  }

  synchronized void markDeleted() {
    state = ManagedFileState.DELETED;
  }

  synchronized void recordDeleteFailure() {
    deleteFailures++;
  }

  @Override
  public String toString() {
    return "ManagedFile[" + id + ", " + filename + ", batch=" + batchId + "]";
  }
}

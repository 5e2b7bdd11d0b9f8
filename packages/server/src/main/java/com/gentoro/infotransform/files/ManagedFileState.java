package com.gentoro.infotransform.files;

/** Lifecycle of a temporary artifact tracked by {@link ManagedFileStore}. */
public enum ManagedFileState {
  /** Stored on disk, never acquired. */
  REGISTERED,
  /** At least one reader holds a reference. */
  IN_USE,
  /** Reference count dropped back to zero; eligible for deletion once its batch completes. */
  RELEASED,
  /** Bytes removed from storage. Terminal. */
  DELETED
}

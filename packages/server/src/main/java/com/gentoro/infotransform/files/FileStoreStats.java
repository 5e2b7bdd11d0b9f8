package com.gentoro.infotransform.files;

/** Point-in-time counters of the managed file store. */
public record FileStoreStats(
    int trackedFiles,
    int activeReferences,
    int pendingDeletion,
    long deletedFiles,
    long deleteFailures,
    long oldestFileAgeSeconds) {}

package com.gentoro.infotransform.jobs;

import com.gentoro.infotransform.webhook.WebhookConfig;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Internal representation of a job. Package-private; every mutation happens while holding the
 * record's monitor, which is also held while taking a {@link JobView} snapshot.
 */
final class JobRecord {
  final String id;
  final String batchId;
  final Instant createdAt;
  final List<String> fileIds;
  final WebhookConfig webhook;

  JobStatus status = JobStatus.QUEUED;
  Instant startedAt;
  Instant finishedAt;
  int completed;
  int failed;
  int skipped;
  boolean cancelRequested;
  String message;
  final Set<String> resolved = new HashSet<>();

  JobRecord(
      String id, String batchId, Instant createdAt, List<String> fileIds, WebhookConfig webhook) {
    this.id = id;
    this.batchId = batchId;
    this.createdAt = createdAt;
    this.fileIds = List.copyOf(fileIds);
    this.webhook = webhook;
  }

  int total() {
    return fileIds.size();
  }

  int accounted() {
    return completed + failed + skipped;
  }
}

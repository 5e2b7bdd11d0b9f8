package com.gentoro.infotransform.jobs;

import com.gentoro.infotransform.batch.BatchResult;
import com.gentoro.infotransform.webhook.WebhookConfig;

/**
 * A lifecycle transition or progress update.
 *
 * @param result the result that caused a {@link JobEventType#PROGRESS} event, otherwise null
 * @param webhook the job's webhook target, or null
 */
public record JobEvent(JobEventType type, JobView job, BatchResult result, WebhookConfig webhook) {}

package com.joshlong.mediaops.tasks;

import java.time.Instant;

/**
 * the durable record of one asynchronous submission.
 */
public record Task(String taskId, TaskStatus status, String taskType, String sourceBucket, String sourceKey,
		String targetBucket, String targetKey, String operations, Instant createdAt, Instant updatedAt,
		String errorMessage) {
}

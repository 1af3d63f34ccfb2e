package com.joshlong.mediaops.tasks;

import com.joshlong.mediaops.validation.Pipeline;

/**
 * the unit of work enqueued for one accepted submission.
 */
record TaskExecutionRequest(String taskId, Pipeline pipeline, String operations, String sourceBucket,
		String sourceKey, String targetBucket, String targetKey) {
}

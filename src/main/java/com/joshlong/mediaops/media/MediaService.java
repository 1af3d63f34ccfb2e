package com.joshlong.mediaops.media;

import com.joshlong.mediaops.execution.ExecutionResult;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.validation.Pipeline;

public interface MediaService {

	/**
	 * parses and validates the operations against the source key, without side effects.
	 * @throws com.joshlong.mediaops.operations.OperationParseException if the operations
	 * are malformed
	 * @throws com.joshlong.mediaops.validation.OperationValidationException if they break a
	 * schema
	 */
	Pipeline plan(MediaKind kind, String key, String operations);

	/**
	 * fetches the source and runs the pipeline over it.
	 */
	ExecutionResult run(Pipeline pipeline, String bucket, String key);

	/**
	 * plans and runs a pipeline over an object in the source bucket, for callers waiting
	 * on the result.
	 */
	ExecutionResult process(MediaKind kind, String key, String operations);

}

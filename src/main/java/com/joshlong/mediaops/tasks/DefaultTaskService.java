package com.joshlong.mediaops.tasks;

import com.joshlong.mediaops.media.MediaService;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.operations.OperationParseException;
import com.joshlong.mediaops.validation.OperationValidationException;
import com.joshlong.mediaops.validation.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.support.MessageBuilder;

import java.util.Optional;
import java.util.UUID;

class DefaultTaskService implements TaskService {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final MediaService mediaService;

	private final TaskStore taskStore;

	private final MessageChannel requests;

	private final String deadLetterChannelName;

	private final String sourceBucket;

	private final String targetBucket;

	private final String targetPrefix;

	DefaultTaskService(MediaService mediaService, TaskStore taskStore, MessageChannel requests,
			String deadLetterChannelName, String sourceBucket, String targetBucket, String targetPrefix) {
		this.mediaService = mediaService;
		this.taskStore = taskStore;
		this.requests = requests;
		this.deadLetterChannelName = deadLetterChannelName;
		this.sourceBucket = sourceBucket;
		this.targetBucket = targetBucket;
		this.targetPrefix = targetPrefix;
	}

	@Override
	public TaskSubmission submit(MediaKind kind, String key, String operations) {
		var taskId = UUID.randomUUID().toString();
		Pipeline pipeline;
		try {
			pipeline = this.mediaService.plan(kind, key, operations);
		} //
		catch (OperationParseException | OperationValidationException e) {
			this.taskStore.create(new Task(taskId, TaskStatus.PROCESSING, kind.taskType(), this.sourceBucket, key,
					this.targetBucket, null, operations, null, null, null));
			this.taskStore.fail(taskId, e.getMessage());
			this.log.info("rejected the {} task {} for [{}]: {}", kind, taskId, key, e.getMessage());
			return new TaskSubmission(taskId, TaskStatus.FAILED, "the task was rejected: " + e.getMessage());
		}
		var targetBucket = bucketOverride(pipeline).orElse(this.targetBucket);
		var targetKey = TargetKeys.artifact(this.targetPrefix, taskId, key, pipeline.outputFormat());
		this.taskStore.create(new Task(taskId, TaskStatus.PROCESSING, kind.taskType(), this.sourceBucket, key,
				targetBucket, targetKey, operations, null, null, null));
		var request = new TaskExecutionRequest(taskId, pipeline, operations, this.sourceBucket, key, targetBucket,
				targetKey);
		var message = MessageBuilder.withPayload(request)
			.setHeader(MessageHeaders.ERROR_CHANNEL, this.deadLetterChannelName)
			.build();
		try {
			this.requests.send(message);
		} //
		catch (RuntimeException e) {
			this.taskStore.fail(taskId, "the task could not be queued: " + e.getMessage());
			throw e;
		}
		this.log.debug("queued the {} task {} for [{}]", kind, taskId, key);
		return new TaskSubmission(taskId, TaskStatus.PROCESSING, "the task has been accepted and is processing");
	}

	@Override
	public Task status(String taskId) {
		return this.taskStore.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
	}

	/**
	 * document conversions may name their own target bucket.
	 */
	private static Optional<String> bucketOverride(Pipeline pipeline) {
		return pipeline.stages()
			.stream()
			.filter(stage -> stage.parameters().given("b"))
			.map(stage -> stage.parameters().string("b"))
			.reduce((first, second) -> second);
	}

}

package com.joshlong.mediaops.tasks;

import com.joshlong.mediaops.execution.ExecutionResult;
import com.joshlong.mediaops.execution.PipelineExecutionException;
import com.joshlong.mediaops.media.MediaService;
import com.joshlong.mediaops.storage.ObjectNotFoundException;
import com.joshlong.mediaops.storage.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * runs one queued task under a wall-clock budget and records how it ended. A pipeline that
 * fails records the task as {@code failed} here; anything else (running out of time or
 * memory, a broken store) escapes as an {@link InfrastructureException} for the dead letter
 * channel to handle.
 */
class TaskRunner {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final MediaService mediaService;

	private final ObjectStore objectStore;

	private final TaskStore taskStore;

	private final AsyncTaskExecutor pipelines;

	private final Duration timeout;

	private final String targetPrefix;

	TaskRunner(MediaService mediaService, ObjectStore objectStore, TaskStore taskStore, AsyncTaskExecutor pipelines,
			Duration timeout, String targetPrefix) {
		this.mediaService = mediaService;
		this.objectStore = objectStore;
		this.taskStore = taskStore;
		this.pipelines = pipelines;
		this.timeout = timeout;
		this.targetPrefix = targetPrefix;
	}

	void run(TaskExecutionRequest request) {
		var taskId = request.taskId();
		var future = this.pipelines.submit(() -> this.execute(request));
		try {
			future.get(this.timeout.toMillis(), TimeUnit.MILLISECONDS);
		} //
		catch (TimeoutException e) {
			// the pipeline can't be stopped mid-stage; its result is discarded
			future.cancel(true);
			throw new InfrastructureException(taskId, InfrastructureException.Category.TIMEOUT,
					"the task " + taskId + " ran longer than " + this.timeout, e);
		} //
		catch (ExecutionException e) {
			var cause = e.getCause();
			throw new InfrastructureException(taskId, InfrastructureException.Category.of(cause),
					"the task " + taskId + " failed unexpectedly: " + cause.getMessage(), cause);
		} //
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new InfrastructureException(taskId, InfrastructureException.Category.PROCESSING,
					"the task " + taskId + " was interrupted", e);
		}
	}

	private Void execute(TaskExecutionRequest request) {
		var taskId = request.taskId();
		try {
			var result = this.mediaService.run(request.pipeline(), request.sourceBucket(), request.sourceKey());
			var location = this.write(request, result);
			if (this.taskStore.complete(taskId, location))
				this.log.info("completed the task {}, writing [{}/{}]", taskId, request.targetBucket(), location);
			else
				this.log.warn("the task {} finished but was already terminal; its result is ignored", taskId);
		} //
		catch (PipelineExecutionException | ObjectNotFoundException e) {
			if (interrupted(e)) {
				// timed out; the dead letter channel records the failure
				this.log.debug("the task {} was stopped", taskId);
				return null;
			}
			this.log.info("the task {} failed: {}", taskId, e.getMessage());
			this.taskStore.fail(taskId, e.getMessage());
		}
		return null;
	}

	private static boolean interrupted(Throwable throwable) {
		for (var t = throwable; t != null; t = t.getCause())
			if (t instanceof InterruptedException)
				return true;
		return Thread.currentThread().isInterrupted();
	}

	/**
	 * @return the key the task record points to: the artifact's, or for page sets the
	 * folder holding every page
	 */
	private String write(TaskExecutionRequest request, ExecutionResult result) {
		if (!result.isMultiPart()) {
			this.objectStore.put(request.targetBucket(), request.targetKey(), result.artifact(), result.contentType());
			return request.targetKey();
		}
		var format = result.metadata().format();
		for (var part : result.parts()) {
			var key = TargetKeys.part(this.targetPrefix, request.taskId(), request.sourceKey(), part.name(), format);
			this.objectStore.put(request.targetBucket(), key, part.bytes(), part.contentType());
		}
		return TargetKeys.folder(this.targetPrefix, request.taskId());
	}

}

package com.joshlong.mediaops.tasks;

import com.joshlong.mediaops.operations.MediaKind;

public interface TaskService {

	/**
	 * records a task for the object and queues it. Returns before any media is touched.
	 */
	TaskSubmission submit(MediaKind kind, String key, String operations);

	/**
	 * @throws TaskNotFoundException if there is no such task
	 */
	Task status(String taskId);

}

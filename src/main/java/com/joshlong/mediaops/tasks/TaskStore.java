package com.joshlong.mediaops.tasks;

import java.util.Optional;

/**
 * durable task records. The terminal writes only apply to a record that is still
 * {@code processing}, so the first one wins.
 */
public interface TaskStore {

	/**
	 * records a new task as {@code processing}.
	 */
	void create(Task task);

	Optional<Task> get(String taskId);

	/**
	 * @return whether this call moved the task to {@code completed}
	 */
	boolean complete(String taskId, String targetKey);

	/**
	 * @return whether this call moved the task to {@code failed}
	 */
	boolean fail(String taskId, String errorMessage);

}

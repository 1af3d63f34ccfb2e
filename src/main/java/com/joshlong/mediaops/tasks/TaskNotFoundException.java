package com.joshlong.mediaops.tasks;

public class TaskNotFoundException extends RuntimeException {

	private final String taskId;

	public TaskNotFoundException(String taskId) {
		super("there is no task [" + taskId + "]");
		this.taskId = taskId;
	}

	public String taskId() {
		return this.taskId;
	}

}

package com.joshlong.mediaops.tasks;

import com.joshlong.mediaops.operations.MediaOperationsException;

import java.util.concurrent.TimeoutException;

/**
 * the environment failed a task, rather than its pipeline: it ran out of time or memory,
 * or something outside the pipeline broke. Never shown to callers; the dead letter channel
 * turns it into a failed task and an alert.
 */
public class InfrastructureException extends MediaOperationsException {

	public enum Category {

		MEMORY("MEMORY LIMIT"), TIMEOUT("TIMEOUT"), PROCESSING("PROCESSING");

		private final String label;

		Category(String label) {
			this.label = label;
		}

		public String label() {
			return this.label;
		}

		/**
		 * classifies a failure by the first cause that says what went wrong.
		 */
		public static Category of(Throwable throwable) {
			for (var t = throwable; t != null; t = t.getCause()) {
				if (t instanceof InfrastructureException ie)
					return ie.category();
				if (t instanceof OutOfMemoryError)
					return MEMORY;
				if (t instanceof TimeoutException)
					return TIMEOUT;
			}
			return PROCESSING;
		}

	}

	private final String taskId;

	private final Category category;

	public InfrastructureException(String taskId, Category category, String message, Throwable cause) {
		super(message, cause);
		this.taskId = taskId;
		this.category = category;
	}

	public String taskId() {
		return this.taskId;
	}

	public Category category() {
		return this.category;
	}

}

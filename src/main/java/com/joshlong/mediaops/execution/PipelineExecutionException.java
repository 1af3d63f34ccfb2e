package com.joshlong.mediaops.execution;

import com.joshlong.mediaops.operations.MediaOperationsException;

/**
 * a handler failed. Carries the stage it failed at; the remaining stages never ran.
 */
public class PipelineExecutionException extends MediaOperationsException {

	private final int position;

	private final String operation;

	public PipelineExecutionException(int position, String operation, Throwable cause) {
		super("stage #" + position + " [" + operation + "] failed: " + describe(cause), cause);
		this.position = position;
		this.operation = operation;
	}

	public PipelineExecutionException(String message) {
		super(message);
		this.position = -1;
		this.operation = null;
	}

	private static String describe(Throwable cause) {
		return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
	}

	public int position() {
		return this.position;
	}

	public String operation() {
		return this.operation;
	}

}

package com.joshlong.mediaops.validation;

import com.joshlong.mediaops.operations.MediaOperationsException;

/**
 * a stage is well formed but its parameters break the schema of its operation or of the
 * output format.
 */
public class OperationValidationException extends MediaOperationsException {

	private final String operation;

	private final String key;

	private final String reason;

	public OperationValidationException(String operation, String key, String reason) {
		super("[" + operation + "] " + (key == null ? "" : "[" + key + "] ") + reason);
		this.operation = operation;
		this.key = key;
		this.reason = reason;
	}

	public String operation() {
		return this.operation;
	}

	public String key() {
		return this.key;
	}

	public String reason() {
		return this.reason;
	}

}

package com.joshlong.mediaops.operations;

/**
 * the operations string is malformed. Raised before anything is fetched or written.
 */
public class OperationParseException extends MediaOperationsException {

	private final int position;

	public OperationParseException(int position, String message) {
		super("stage #" + position + ": " + message);
		this.position = position;
	}

	public int position() {
		return this.position;
	}

}

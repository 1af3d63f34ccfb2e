package com.joshlong.mediaops.operations;

/**
 * root of the failures raised while turning an operations string into an artifact.
 */
public abstract class MediaOperationsException extends RuntimeException {

	protected MediaOperationsException(String message) {
		super(message);
	}

	protected MediaOperationsException(String message, Throwable cause) {
		super(message, cause);
	}

}

package com.joshlong.mediaops.tasks;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * {@code processing} moves to exactly one of the two terminal states and stays there.
 */
public enum TaskStatus {

	PROCESSING("processing"), COMPLETED("completed"), FAILED("failed");

	private final String value;

	TaskStatus(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return this.value;
	}

	public boolean isTerminal() {
		return this != PROCESSING;
	}

	public static TaskStatus of(String value) {
		return Arrays.stream(values())
			.filter(status -> status.value.equals(value))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("there is no task status called [" + value + "]"));
	}

}

package com.joshlong.mediaops.operations;

public enum AudioOperation implements Operation {

	CONVERT("convert");

	private final String operationName;

	AudioOperation(String operationName) {
		this.operationName = operationName;
	}

	@Override
	public String operationName() {
		return this.operationName;
	}

	@Override
	public MediaKind kind() {
		return MediaKind.AUDIO;
	}

}

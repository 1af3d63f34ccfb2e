package com.joshlong.mediaops.operations;

public enum VideoOperation implements Operation {

	SNAPSHOT("snapshot");

	private final String operationName;

	VideoOperation(String operationName) {
		this.operationName = operationName;
	}

	@Override
	public String operationName() {
		return this.operationName;
	}

	@Override
	public MediaKind kind() {
		return MediaKind.VIDEO;
	}

}

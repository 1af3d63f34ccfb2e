package com.joshlong.mediaops.operations;

public enum DocumentOperation implements Operation {

	CONVERT("convert");

	private final String operationName;

	DocumentOperation(String operationName) {
		this.operationName = operationName;
	}

	@Override
	public String operationName() {
		return this.operationName;
	}

	@Override
	public MediaKind kind() {
		return MediaKind.DOCUMENT;
	}

}

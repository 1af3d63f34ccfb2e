package com.joshlong.mediaops.operations;

public enum ImageOperation implements Operation {

	AUTO_ORIENT("auto-orient"), RESIZE("resize"), CROP("crop"), ROTATE("rotate"), BLUR("blur"),
	GRAYSCALE("grayscale"), WATERMARK("watermark"), FORMAT("format"), QUALITY("quality");

	private final String operationName;

	ImageOperation(String operationName) {
		this.operationName = operationName;
	}

	@Override
	public String operationName() {
		return this.operationName;
	}

	@Override
	public MediaKind kind() {
		return MediaKind.IMAGE;
	}

}

package com.joshlong.mediaops.operations;

import java.util.Locale;

/**
 * the four disjoint operation namespaces. Each one has its own closed set of
 * {@link Operation operations}, its own schema tables, and its own handlers.
 */
public enum MediaKind {

	IMAGE("image/process"), AUDIO("audio/process"), VIDEO("video/process"), DOCUMENT("doc/convert");

	private final String taskType;

	MediaKind(String taskType) {
		this.taskType = taskType;
	}

	/**
	 * @return the tag recorded on a task record for work of this kind
	 */
	public String taskType() {
		return this.taskType;
	}

	public static MediaKind of(String name) {
		var normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
		return switch (normalized) {
			case "image", "images" -> IMAGE;
			case "audio" -> AUDIO;
			case "video", "videos" -> VIDEO;
			case "doc", "docs", "document", "documents" -> DOCUMENT;
			default -> throw new IllegalArgumentException("there is no media kind called [" + name + "]");
		};
	}

}

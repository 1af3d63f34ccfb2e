package com.joshlong.mediaops.execution;

import java.util.List;

/**
 * the outcome of a successful pipeline run.
 *
 * @param artifact the final bytes
 * @param metadata what is known about the final bytes
 * @param contentType the content type of the output format
 * @param etag the hex MD5 of the final bytes
 * @param parts any further artifacts, like rendered pages
 */
public record ExecutionResult(byte[] artifact, MediaMetadata metadata, String contentType, String etag,
		List<MediaPart> parts) {

	public ExecutionResult {
		parts = List.copyOf(parts);
	}

	public boolean isMultiPart() {
		return !this.parts.isEmpty();
	}

}

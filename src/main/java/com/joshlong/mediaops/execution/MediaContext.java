package com.joshlong.mediaops.execution;

import org.springframework.util.Assert;

import java.util.List;

/**
 * the state threaded through a pipeline. Every stage receives the context the previous
 * stage produced and returns a new one.
 *
 * @param artifact the current bytes
 * @param metadata what is known about the current bytes
 * @param parts additional artifacts produced along the way, in order
 */
public record MediaContext(byte[] artifact, MediaMetadata metadata, List<MediaPart> parts) {

	public MediaContext {
		Assert.notNull(artifact, "the artifact must not be null");
		Assert.notNull(metadata, "the metadata must not be null");
		parts = List.copyOf(parts);
	}

	public static MediaContext of(byte[] artifact, String format) {
		return new MediaContext(artifact, MediaMetadata.of(format), List.of());
	}

	public MediaContext withArtifact(byte[] artifact, String format) {
		return new MediaContext(artifact, this.metadata.withFormat(format), this.parts);
	}

	public MediaContext withArtifact(byte[] artifact) {
		return new MediaContext(artifact, this.metadata, this.parts);
	}

	public MediaContext withMetadata(MediaMetadata metadata) {
		return new MediaContext(this.artifact, metadata, this.parts);
	}

	public MediaContext withParts(List<MediaPart> parts) {
		return new MediaContext(this.artifact, this.metadata, parts);
	}

	public String format() {
		return this.metadata.format();
	}

}

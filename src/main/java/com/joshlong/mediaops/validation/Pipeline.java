package com.joshlong.mediaops.validation;

import com.joshlong.mediaops.operations.MediaKind;

import java.util.List;

/**
 * an ordered, validated, immutable sequence of stages and the format they produce.
 *
 * @param kind the media kind whose namespace the stages belong to
 * @param stages the stages, in the order they were written
 * @param outputFormat the format of the final artifact
 * @param contentType the content type of the final artifact
 */
public record Pipeline(MediaKind kind, List<Stage> stages, String outputFormat, String contentType) {

	public Pipeline {
		stages = List.copyOf(stages);
	}

	public boolean isEmpty() {
		return this.stages.isEmpty();
	}

}

package com.joshlong.mediaops.video;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * the parts of an {@code ffprobe} stream description we care about.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record VideoStream(@JsonProperty("codec_type") String codecType, @JsonProperty("codec_name") String codecName,
		@JsonProperty("width") int width, @JsonProperty("height") int height,
		@JsonProperty("color_primaries") String colorPrimaries, @JsonProperty("duration") String duration) {

	/**
	 * @return the duration in milliseconds, or -1 if ffprobe didn't report one
	 */
	long durationMillis() {
		if (this.duration == null || this.duration.isBlank())
			return -1;
		try {
			return Math.round(Double.parseDouble(this.duration) * 1000);
		}
		catch (NumberFormatException e) {
			return -1;
		}
	}

}

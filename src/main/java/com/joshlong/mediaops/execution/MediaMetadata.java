package com.joshlong.mediaops.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * what is known about the current artifact: its format and whatever descriptors the
 * handlers have recorded (width, height, duration, pages, ...).
 */
public record MediaMetadata(String format, Map<String, Object> attributes) {

	public static final String WIDTH = "width";

	public static final String HEIGHT = "height";

	public static final String PAGES = "pages";

	public static final String DURATION = "duration";

	/**
	 * the format the pipeline has to produce. Handlers that re-encode without being told a
	 * format encode into this one.
	 */
	public static final String OUTPUT_FORMAT = "outputFormat";

	public MediaMetadata {
		attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
	}

	public static MediaMetadata of(String format) {
		return new MediaMetadata(format, Map.of());
	}

	public MediaMetadata withFormat(String format) {
		return new MediaMetadata(format, this.attributes);
	}

	public MediaMetadata with(String key, Object value) {
		var copy = new LinkedHashMap<>(this.attributes);
		copy.put(key, value);
		return new MediaMetadata(this.format, copy);
	}

	public Optional<Object> attribute(String key) {
		return Optional.ofNullable(this.attributes.get(key));
	}

}

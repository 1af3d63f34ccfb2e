package com.joshlong.mediaops.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * what one output format accepts for the governed keys of its media kind, and the values
 * it implies when they're absent. A governed key without a constraint here is not
 * supported by the format.
 *
 * @param format the format name, e.g. {@code mp3}
 * @param contentType the content type of artifacts in this format
 * @param constraints constraints per governed key
 * @param defaults values filled in for governed keys the caller left out
 */
public record FormatConstraints(String format, String contentType, Map<String, NumericConstraint> constraints,
		Map<String, Integer> defaults) {

	public FormatConstraints {
		constraints = Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
		defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
	}

	public static FormatConstraints of(String format, String contentType) {
		return new FormatConstraints(format, contentType, Map.of(), Map.of());
	}

	public FormatConstraints allow(String key, NumericConstraint constraint) {
		var copy = new LinkedHashMap<>(this.constraints);
		copy.put(key, constraint);
		return new FormatConstraints(this.format, this.contentType, copy, this.defaults);
	}

	public FormatConstraints defaultTo(String key, int value) {
		var copy = new LinkedHashMap<>(this.defaults);
		copy.put(key, value);
		return new FormatConstraints(this.format, this.contentType, this.constraints, copy);
	}

	public Optional<NumericConstraint> constraint(String key) {
		return Optional.ofNullable(this.constraints.get(key));
	}

}

package com.joshlong.mediaops.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * output format to {@link FormatConstraints}, plus the keys whose values depend on the
 * output format.
 */
public record FormatConstraintTable(Set<String> governedKeys, Map<String, FormatConstraints> formats) {

	// alternative spellings of a format, keyed by the spelling
	private static final Map<String, String> ALIASES = Map.of("tif", "tiff");

	public FormatConstraintTable {
		governedKeys = Set.copyOf(governedKeys);
		formats = Collections.unmodifiableMap(new LinkedHashMap<>(formats));
	}

	public static FormatConstraintTable of(Set<String> governedKeys, FormatConstraints... formats) {
		var map = new LinkedHashMap<String, FormatConstraints>();
		for (var f : formats)
			map.put(f.format(), f);
		return new FormatConstraintTable(governedKeys, map);
	}

	public Optional<FormatConstraints> lookup(String format) {
		if (format == null)
			return Optional.empty();
		var lower = format.toLowerCase(Locale.ROOT);
		return Optional.ofNullable(this.formats.get(ALIASES.getOrDefault(lower, lower)));
	}

	public boolean governs(String key) {
		return this.governedKeys.contains(key);
	}

}

package com.joshlong.mediaops.validation;

import org.springframework.util.Assert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * the coerced, defaulted parameters of one validated stage. Handlers read them through
 * the typed getters; a getter for a key that has no value fails.
 */
public final class StageParameters {

	private final Map<String, Object> values;

	private final Set<String> given;

	StageParameters(Map<String, Object> values, Set<String> given) {
		this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
		this.given = Set.copyOf(given);
	}

	public static StageParameters of(Map<String, Object> values) {
		return new StageParameters(values, values.keySet());
	}

	public static StageParameters empty() {
		return new StageParameters(Map.of(), Set.of());
	}

	StageParameters with(String key, Object value) {
		var copy = new LinkedHashMap<>(this.values);
		copy.put(key, value);
		return new StageParameters(copy, this.given);
	}

	public boolean has(String key) {
		return this.values.containsKey(key);
	}

	/**
	 * @return whether the caller wrote this key, as opposed to it being defaulted
	 */
	public boolean given(String key) {
		return this.given.contains(key);
	}

	public int integer(String key) {
		return this.require(key, Integer.class);
	}

	public Optional<Integer> optionalInteger(String key) {
		return Optional.ofNullable(this.values.get(key)).map(Integer.class::cast);
	}

	public String string(String key) {
		return this.require(key, String.class);
	}

	public Optional<String> optionalString(String key) {
		return Optional.ofNullable(this.values.get(key)).map(String.class::cast);
	}

	public boolean flag(String key) {
		var value = this.values.get(key);
		return value != null && (Boolean) value;
	}

	@SuppressWarnings("unchecked")
	public List<Integer> pages(String key) {
		return (List<Integer>) this.require(key, List.class);
	}

	public Map<String, Object> asMap() {
		return this.values;
	}

	private <T> T require(String key, Class<T> type) {
		var value = this.values.get(key);
		Assert.state(value != null, () -> "there is no value for [" + key + "]");
		return type.cast(value);
	}

	@Override
	public String toString() {
		return this.values.toString();
	}

}

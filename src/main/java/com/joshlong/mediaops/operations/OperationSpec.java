package com.joshlong.mediaops.operations;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * one parsed, not yet validated, stage.
 *
 * @param operation the operation tag
 * @param params raw values keyed by parameter name, in source order. A bare token is
 * recorded with an empty value.
 * @param position the zero-based index of the stage in the operations string
 */
public record OperationSpec(Operation operation, Map<String, String> params, int position) {

	public OperationSpec {
		params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
	}

	public boolean isBare(String key) {
		return this.params.containsKey(key) && this.params.get(key).isEmpty();
	}

}

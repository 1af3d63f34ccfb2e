package com.joshlong.mediaops.validation;

import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.operations.Operation;
import org.springframework.util.Assert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * every schema table of one media kind.
 *
 * @param kind the media kind
 * @param operations one schema per operation of the kind
 * @param formats the output format table
 * @param outputFormat where the output format of a pipeline comes from
 */
public record MediaSchema(MediaKind kind, Map<Operation, OperationSchema> operations, FormatConstraintTable formats,
		OutputFormat outputFormat) {

	/**
	 * the output format is the value of {@code key} on the last stage running
	 * {@code operation}; failing that the source format, when the table knows it; failing
	 * that {@code fallback}.
	 */
	public record OutputFormat(Operation operation, String key, String fallback) {
	}

	public MediaSchema {
		operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
		for (var operation : operations.keySet())
			Assert.state(operation.kind() == kind,
					() -> operation.operationName() + " does not belong to " + kind);
	}

	public static MediaSchema of(MediaKind kind, List<OperationSchema> operations, FormatConstraintTable formats,
			OutputFormat outputFormat) {
		var map = new LinkedHashMap<Operation, OperationSchema>();
		for (var o : operations)
			map.put(o.operation(), o);
		return new MediaSchema(kind, map, formats, outputFormat);
	}

	public Optional<OperationSchema> operation(Operation operation) {
		return Optional.ofNullable(this.operations.get(operation));
	}

}

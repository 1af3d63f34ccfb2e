package com.joshlong.mediaops.validation;

import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.operations.Operation;
import org.springframework.util.Assert;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * the schema tables of every media kind, assembled once at startup. Refuses to start if a
 * media kind, or an operation of one, has no schema.
 */
public class SchemaRegistry {

	private final Map<MediaKind, MediaSchema> schemas;

	public SchemaRegistry(Collection<MediaSchema> schemas) {
		var map = new EnumMap<MediaKind, MediaSchema>(MediaKind.class);
		for (var schema : schemas) {
			Assert.state(!map.containsKey(schema.kind()), () -> "there are two schemas for " + schema.kind());
			map.put(schema.kind(), schema);
		}
		for (var kind : MediaKind.values()) {
			var schema = map.get(kind);
			Assert.state(schema != null, () -> "there is no schema for " + kind);
			for (var operation : Operation.all(kind))
				Assert.state(schema.operations().containsKey(operation),
						() -> "there is no schema for the " + kind + " operation " + operation.operationName());
		}
		this.schemas = Collections.unmodifiableMap(map);
	}

	public MediaSchema schema(MediaKind kind) {
		return this.schemas.get(kind);
	}

}

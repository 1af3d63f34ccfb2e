package com.joshlong.mediaops.operations;

import java.util.List;
import java.util.Optional;

/**
 * a tag for one operation in one {@link MediaKind media kind's} namespace. The set of
 * implementations is closed: each media kind contributes exactly one enum.
 */
public sealed interface Operation permits ImageOperation, AudioOperation, VideoOperation, DocumentOperation {

	/**
	 * @return the name as written in an operations string, e.g. {@code auto-orient}
	 */
	String operationName();

	MediaKind kind();

	/**
	 * resolves the operation called {@code name} in the namespace of the given kind.
	 */
	static Optional<Operation> lookup(MediaKind kind, String name) {
		return all(kind).stream().filter(operation -> operation.operationName().equals(name)).findFirst();
	}

	/**
	 * every operation in the namespace of the given kind.
	 */
	static List<Operation> all(MediaKind kind) {
		Operation[] candidates = switch (kind) {
			case IMAGE -> ImageOperation.values();
			case AUDIO -> AudioOperation.values();
			case VIDEO -> VideoOperation.values();
			case DOCUMENT -> DocumentOperation.values();
		};
		return List.of(candidates);
	}

}

package com.joshlong.mediaops.tasks;

import com.joshlong.mediaops.utils.FileUtils;
import org.springframework.util.StringUtils;

/**
 * results are written under {@code <prefix>/<task id>/}, so no two tasks share a key.
 */
abstract class TargetKeys {

	static String folder(String prefix, String taskId) {
		var trimmed = StringUtils.trimTrailingCharacter(prefix == null ? "" : prefix, '/');
		return (trimmed.isEmpty() ? "" : trimmed + "/") + taskId + "/";
	}

	static String artifact(String prefix, String taskId, String sourceKey, String format) {
		return folder(prefix, taskId) + FileUtils.baseName(sourceKey) + "." + format;
	}

	static String part(String prefix, String taskId, String sourceKey, String partName, String format) {
		return folder(prefix, taskId) + FileUtils.baseName(sourceKey) + "_" + partName + "." + format;
	}

}

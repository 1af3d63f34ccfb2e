package com.joshlong.mediaops.video;

import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.operations.VideoOperation;
import com.joshlong.mediaops.validation.FormatConstraintTable;
import com.joshlong.mediaops.validation.FormatConstraints;
import com.joshlong.mediaops.validation.MediaSchema;
import com.joshlong.mediaops.validation.OperationSchema;

import java.util.List;
import java.util.Set;

import static com.joshlong.mediaops.validation.ParamSchema.of;
import static com.joshlong.mediaops.validation.ParamType.between;
import static com.joshlong.mediaops.validation.ParamType.oneOf;

public final class VideoSchemas {

	public static final MediaSchema SCHEMA = MediaSchema.of(MediaKind.VIDEO, List.of(snapshot()),
			FormatConstraintTable.of(Set.of(), FormatConstraints.of("jpg", "image/jpeg"),
					FormatConstraints.of("png", "image/png")),
			new MediaSchema.OutputFormat(VideoOperation.SNAPSHOT, "f", "jpg"));

	private VideoSchemas() {
	}

	private static OperationSchema snapshot() {
		return OperationSchema.of(VideoOperation.SNAPSHOT) //
			.param(of("t", between(0, 86_400_000)).defaultsTo("0")) //
			.param(of("w", between(0, 16_384)).defaultsTo("0")) //
			.param(of("h", between(0, 16_384)).defaultsTo("0")) //
			.param(of("m", oneOf("default", "fast")).defaultsTo("default")) //
			.param(of("f", oneOf("jpg", "png")).defaultsTo("jpg")) //
			.param(of("ar", oneOf("auto", "h", "w")).defaultsTo("auto")) //
			.build();
	}

}

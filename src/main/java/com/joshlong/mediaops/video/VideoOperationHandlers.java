package com.joshlong.mediaops.video;

import com.joshlong.mediaops.execution.MediaContext;
import com.joshlong.mediaops.execution.MediaMetadata;
import com.joshlong.mediaops.execution.OperationHandler;
import com.joshlong.mediaops.execution.OperationHandlers;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.operations.VideoOperation;
import com.joshlong.mediaops.utils.FileUtils;
import com.joshlong.mediaops.utils.ProcessUtils;
import com.joshlong.mediaops.validation.StageParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;

class VideoOperationHandlers implements OperationHandlers<VideoOperation> {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final String ffmpeg;

	private final VideoProbe probe;

	VideoOperationHandlers(String ffmpeg, VideoProbe probe) {
		this.ffmpeg = ffmpeg;
		this.probe = probe;
	}

	@Override
	public MediaKind kind() {
		return MediaKind.VIDEO;
	}

	@Override
	public Class<VideoOperation> operationType() {
		return VideoOperation.class;
	}

	@Override
	public OperationHandler handlerFor(VideoOperation operation) {
		return switch (operation) {
			case SNAPSHOT -> this::snapshot;
		};
	}

	private MediaContext snapshot(MediaContext context, StageParameters parameters)
			throws IOException, InterruptedException {
		var directory = FileUtils.createWorkingDirectory("video");
		try {
			var sourceFormat = context.format() == null ? "mp4" : context.format();
			var input = FileUtils.write(directory, "input." + sourceFormat, context.artifact());
			var stream = this.probe.probe(input);
			var duration = stream.durationMillis();
			var at = parameters.integer("t");
			if (duration >= 0 && at > duration)
				throw new IllegalArgumentException(
						"the snapshot time " + at + "ms is past the end of the " + duration + "ms video");
			var size = SnapshotCommand.dimensions(stream.width(), stream.height(), parameters.integer("w"),
					parameters.integer("h"));
			var format = parameters.string("f");
			var output = directory.resolve("snapshot." + format);
			ProcessUtils.runCommand(SnapshotCommand.build(this.ffmpeg, input.toAbsolutePath().toString(),
					output.toAbsolutePath().toString(), size, parameters));
			if (!Files.exists(output) || Files.size(output) == 0)
				throw new IllegalStateException("ffmpeg produced no frame at " + at + "ms");
			var bytes = Files.readAllBytes(output);
			this.log.debug("took a {}x{} {} snapshot at {}ms", size.width, size.height, format, at);
			var metadata = context.metadata()
				.withFormat(format)
				.with(MediaMetadata.WIDTH, size.width)
				.with(MediaMetadata.HEIGHT, size.height)
				.with(MediaMetadata.DURATION, duration);
			return context.withArtifact(bytes).withMetadata(metadata);
		} //
		finally {
			FileUtils.delete(directory);
		}
	}

}

package com.joshlong.mediaops.audio;

import com.joshlong.mediaops.execution.MediaContext;
import com.joshlong.mediaops.execution.OperationHandler;
import com.joshlong.mediaops.execution.OperationHandlers;
import com.joshlong.mediaops.operations.AudioOperation;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.utils.FileUtils;
import com.joshlong.mediaops.utils.ProcessUtils;
import com.joshlong.mediaops.validation.StageParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

/**
 * audio operations, run with {@code ffmpeg}. Only WAV sources are accepted.
 */
class AudioOperationHandlers implements OperationHandlers<AudioOperation> {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final String ffmpeg;

	AudioOperationHandlers(String ffmpeg) {
		this.ffmpeg = ffmpeg;
	}

	@Override
	public MediaKind kind() {
		return MediaKind.AUDIO;
	}

	@Override
	public Class<AudioOperation> operationType() {
		return AudioOperation.class;
	}

	@Override
	public OperationHandler handlerFor(AudioOperation operation) {
		return switch (operation) {
			case CONVERT -> this::convert;
		};
	}

	private MediaContext convert(MediaContext context, StageParameters parameters)
			throws IOException, InterruptedException {
		if (!isWav(context.artifact()))
			throw new IllegalArgumentException(
					"only WAV sources can be converted, not [" + context.format() + "]");
		var format = parameters.string("f");
		var directory = FileUtils.createWorkingDirectory("audio");
		try {
			var input = FileUtils.write(directory, "input.wav", context.artifact());
			var output = directory.resolve("output." + format);
			var command = FfmpegAudioCommand.build(this.ffmpeg, input.toAbsolutePath().toString(),
					output.toAbsolutePath().toString(), parameters);
			ProcessUtils.runCommand(command);
			var bytes = Files.readAllBytes(output);
			this.log.debug("converted {} bytes of wav into {} bytes of {}", context.artifact().length, bytes.length,
					format);
			return context.withArtifact(bytes, format);
		} //
		finally {
			FileUtils.delete(directory);
		}
	}

	/**
	 * a RIFF container holding WAVE data.
	 */
	static boolean isWav(byte[] bytes) {
		return bytes.length >= 12
				&& new String(Arrays.copyOfRange(bytes, 0, 4), StandardCharsets.US_ASCII).equals("RIFF")
				&& new String(Arrays.copyOfRange(bytes, 8, 12), StandardCharsets.US_ASCII).equals("WAVE");
	}

}

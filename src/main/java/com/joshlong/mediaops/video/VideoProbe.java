package com.joshlong.mediaops.video;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.joshlong.mediaops.utils.JsonUtils;
import com.joshlong.mediaops.utils.ProcessUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * reads the video stream of a file with {@code ffprobe} and checks that we can decode it.
 */
class VideoProbe {

	static final Set<String> SUPPORTED_CODECS = Set.of("h264", "hevc");

	@JsonIgnoreProperties(ignoreUnknown = true)
	record ProbeResult(List<VideoStream> streams) {
	}

	private final String ffprobe;

	VideoProbe(String ffprobe) {
		this.ffprobe = ffprobe;
	}

	VideoStream probe(Path video) throws IOException, InterruptedException {
		var result = ProcessUtils.runCommand(this.ffprobe, "-v", "quiet", "-print_format", "json", "-show_streams",
				video.toAbsolutePath().toString());
		return videoStream(result.stdoutAsString());
	}

	static VideoStream videoStream(String json) {
		var result = JsonUtils.read(json, ProbeResult.class);
		var streams = result.streams() == null ? List.<VideoStream>of() : result.streams();
		var stream = streams.stream()
			.filter(s -> "video".equals(s.codecType()))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("there is no video stream"));
		if (!SUPPORTED_CODECS.contains(stream.codecName()))
			throw new IllegalArgumentException(
					"the video codec [" + stream.codecName() + "] is not supported, only " + SUPPORTED_CODECS);
		if (stream.colorPrimaries() != null && stream.colorPrimaries().startsWith("bt2020"))
			throw new IllegalArgumentException("BT.2020 video is not supported");
		return stream;
	}

}

package com.joshlong.mediaops.video;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class VideoProbeTest {

	private static String probe(String codec, String primaries) {
		return """
				{ "streams" : [
				   { "index" : 0, "codec_type" : "audio", "codec_name" : "aac" },
				   { "index" : 1, "codec_type" : "video", "codec_name" : "%s", "width" : 1920, "height" : 1080,
				     "color_primaries" : "%s", "duration" : "12.5", "r_frame_rate" : "30/1" }
				] }
				""".formatted(codec, primaries);
	}

	@Test
	void theFirstVideoStreamIsDescribed() {
		var stream = VideoProbe.videoStream(probe("h264", "bt709"));
		Assertions.assertEquals(1920, stream.width());
		Assertions.assertEquals(1080, stream.height());
		Assertions.assertEquals(12_500, stream.durationMillis());
	}

	@Test
	void unsupportedVideoIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> VideoProbe.videoStream(probe("vp9", "bt709")));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> VideoProbe.videoStream(probe("hevc", "bt2020")));
		Assertions.assertThrows(IllegalArgumentException.class, () -> VideoProbe.videoStream("""
				{ "streams" : [ { "codec_type" : "audio", "codec_name" : "aac" } ] }
				"""));
	}

}

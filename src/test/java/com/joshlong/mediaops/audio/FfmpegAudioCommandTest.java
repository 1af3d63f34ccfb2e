package com.joshlong.mediaops.audio;

import com.joshlong.mediaops.validation.StageParameters;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

class FfmpegAudioCommandTest {

	private static List<String> build(Map<String, Object> parameters) {
		return FfmpegAudioCommand.build("ffmpeg", "in.wav", "out", StageParameters.of(parameters));
	}

	@Test
	void timesAreGivenInSeconds() {
		var command = build(Map.of("f", "mp3", "ss", 1500, "t", 2000));
		Assertions.assertEquals("ffmpeg", command.get(0));
		var seek = command.indexOf("-ss");
		var input = command.indexOf("-i");
		Assertions.assertTrue(seek > 0 && seek < input, "seeking happens before the input is opened");
		Assertions.assertEquals("1.500", command.get(seek + 1));
		Assertions.assertEquals("2.000", command.get(command.indexOf("-t") + 1));
		Assertions.assertEquals("out", command.get(command.size() - 1));
	}

	@Test
	void samplingAndQuality() {
		var command = build(Map.of("f", "mp3", "ar", 44100, "ac", 2, "aq", 90));
		Assertions.assertEquals("44100", command.get(command.indexOf("-ar") + 1));
		Assertions.assertEquals("2", command.get(command.indexOf("-ac") + 1));
		Assertions.assertEquals("1", command.get(command.indexOf("-q:a") + 1));
		Assertions.assertEquals(-1, command.indexOf("-b:a"));
		Assertions.assertEquals("libmp3lame", command.get(command.indexOf("-c:a") + 1));
	}

	@Test
	void bitrateModes() {
		Assertions.assertEquals(List.of("-b:a", "96000", "-minrate", "96000", "-maxrate", "96000"),
				FfmpegAudioCommand.bitrate(96000, 0));
		Assertions.assertEquals(List.of("-b:a", "96000"), FfmpegAudioCommand.bitrate(96000, 1));
		Assertions.assertEquals(List.of("-b:a", "96000", "-maxrate", "96000", "-bufsize", "192000"),
				FfmpegAudioCommand.bitrate(96000, 2));
		var command = build(Map.of("f", "ac3", "ab", 192000));
		Assertions.assertEquals(1, Collections.frequency(command, "-b:a"));
		Assertions.assertEquals(-1, command.indexOf("-minrate"), "an average bitrate is the default");
	}

	@Test
	void flacBitDepth() {
		var command = build(Map.of("f", "flac", "adepth", 24));
		Assertions.assertEquals("s32", command.get(command.indexOf("-sample_fmt") + 1));
		Assertions.assertEquals("flac", command.get(command.indexOf("-f") + 1));
	}

	@Test
	void qualityScales() {
		Assertions.assertEquals("0", FfmpegAudioCommand.quality("mp3", 100));
		Assertions.assertEquals("9", FfmpegAudioCommand.quality("mp3", 0));
		Assertions.assertEquals("5.0", FfmpegAudioCommand.quality("oga", 50));
		Assertions.assertEquals("1.00", FfmpegAudioCommand.quality("m4a", 50));
	}

	@Test
	void everyOutputFormatHasACodec() {
		for (var format : List.of("mp3", "m4a", "flac", "oga", "ac3", "opus", "amr"))
			Assertions.assertEquals(4, FfmpegAudioCommand.codec(format).size(), format);
		Assertions.assertThrows(IllegalArgumentException.class, () -> FfmpegAudioCommand.codec("wav"));
	}

}

package com.joshlong.mediaops.audio;

import com.joshlong.mediaops.validation.StageParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * builds the {@code ffmpeg} arguments for one {@code convert} stage. Times are given in
 * milliseconds and passed on in seconds.
 */
abstract class FfmpegAudioCommand {

	static List<String> build(String ffmpeg, String input, String output, StageParameters parameters) {
		var format = parameters.string("f");
		var command = new ArrayList<String>(List.of(ffmpeg, "-hide_banner", "-loglevel", "error", "-y"));
		parameters.optionalInteger("ss").ifPresent(ss -> command.addAll(List.of("-ss", seconds(ss))));
		command.addAll(List.of("-i", input));
		parameters.optionalInteger("t").ifPresent(t -> command.addAll(List.of("-t", seconds(t))));
		command.add("-vn");
		parameters.optionalInteger("ar").ifPresent(ar -> command.addAll(List.of("-ar", String.valueOf(ar))));
		parameters.optionalInteger("ac").ifPresent(ac -> command.addAll(List.of("-ac", String.valueOf(ac))));
		parameters.optionalInteger("aq").ifPresent(aq -> command.addAll(List.of("-q:a", quality(format, aq))));
		parameters.optionalInteger("ab")
			.ifPresent(ab -> command.addAll(bitrate(ab, parameters.optionalInteger("abopt").orElse(1))));
		parameters.optionalInteger("adepth")
			.ifPresent(depth -> command.addAll(List.of("-sample_fmt", depth == 16 ? "s16" : "s32")));
		command.addAll(codec(format));
		command.add(output);
		return command;
	}

	/**
	 * the codec and container of each output format.
	 */
	static List<String> codec(String format) {
		return switch (format) {
			case "mp3" -> List.of("-c:a", "libmp3lame", "-f", "mp3");
			case "m4a" -> List.of("-c:a", "aac", "-f", "mp4");
			case "flac" -> List.of("-c:a", "flac", "-f", "flac");
			case "oga" -> List.of("-c:a", "libvorbis", "-f", "ogg");
			case "ac3" -> List.of("-c:a", "ac3", "-f", "ac3");
			case "opus" -> List.of("-c:a", "libopus", "-f", "opus");
			case "amr" -> List.of("-c:a", "libopencore_amrnb", "-f", "amr");
			default -> throw new IllegalArgumentException("there is no codec for [" + format + "]");
		};
	}

	/**
	 * maps 0 (worst) to 100 (best) onto each encoder's own variable-quality scale.
	 */
	static String quality(String format, int aq) {
		return switch (format) {
			// lame: 0 is best, 9 is worst
			case "mp3" -> String.valueOf(Math.round((100 - aq) * 9 / 100f));
			// vorbis: -1 to 10
			case "oga" -> String.format(Locale.ROOT, "%.1f", aq / 10f);
			// native aac: 0.1 to 2
			case "m4a" -> String.format(Locale.ROOT, "%.2f", Math.max(0.1f, aq / 50f));
			default -> String.valueOf(aq);
		};
	}

	/**
	 * {@code abopt} 0 is a constant bitrate, 1 an average bitrate and 2 a maximum bitrate.
	 */
	static List<String> bitrate(int ab, int abopt) {
		var rate = String.valueOf(ab);
		return switch (abopt) {
			case 0 -> List.of("-b:a", rate, "-minrate", rate, "-maxrate", rate);
			case 2 -> List.of("-b:a", rate, "-maxrate", rate, "-bufsize", String.valueOf(ab * 2));
			default -> List.of("-b:a", rate);
		};
	}

	private static String seconds(int milliseconds) {
		return String.format(Locale.ROOT, "%.3f", milliseconds / 1000d);
	}

}

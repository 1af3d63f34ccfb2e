package com.joshlong.mediaops.video;

import com.joshlong.mediaops.validation.StageParameters;

import java.awt.Dimension;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * the size of a snapshot and the {@code ffmpeg} arguments that take it.
 */
abstract class SnapshotCommand {

	/**
	 * a zero width or height follows the other one, keeping the aspect ratio. Both zero
	 * keeps the original size.
	 */
	static Dimension dimensions(int width, int height, int targetWidth, int targetHeight) {
		if (targetWidth == 0 && targetHeight == 0)
			return new Dimension(width, height);
		if (targetWidth == 0)
			return new Dimension((int) ((long) targetHeight * width / height), targetHeight);
		if (targetHeight == 0)
			return new Dimension(targetWidth, (int) ((long) targetWidth * height / width));
		return new Dimension(targetWidth, targetHeight);
	}

	/**
	 * {@code ar_h} turns a landscape frame upright, {@code ar_w} turns a portrait frame on
	 * its side, and {@code m_fast} only looks at key frames.
	 */
	static List<String> filters(Dimension size, StageParameters parameters) {
		var filters = new ArrayList<String>();
		if (parameters.string("m").equals("fast"))
			filters.add("select=eq(pict_type\\,I)");
		filters.add("scale=" + size.width + ":" + size.height);
		var rotation = parameters.string("ar");
		if (rotation.equals("h") && size.width > size.height)
			filters.add("transpose=1");
		else if (rotation.equals("w") && size.width < size.height)
			filters.add("transpose=2");
		return filters;
	}

	static List<String> build(String ffmpeg, String input, String output, Dimension size,
			StageParameters parameters) {
		var command = new ArrayList<String>(List.of(ffmpeg, "-hide_banner", "-loglevel", "error", "-y"));
		command.addAll(List.of("-ss", String.format(Locale.ROOT, "%.3f", parameters.integer("t") / 1000d)));
		command.addAll(List.of("-i", input));
		command.addAll(List.of("-vf", String.join(",", filters(size, parameters))));
		if (parameters.string("f").equals("jpg"))
			command.addAll(List.of("-qscale:v", "2"));
		else
			command.addAll(List.of("-compression_level", "3"));
		command.addAll(List.of("-frames:v", "1", output));
		return command;
	}

}

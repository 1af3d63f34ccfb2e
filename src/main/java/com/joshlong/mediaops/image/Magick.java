package com.joshlong.mediaops.image;

import com.joshlong.mediaops.utils.FileUtils;
import com.joshlong.mediaops.utils.ProcessUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * shells out to ImageMagick for what Java2D can't do: reading the EXIF orientation and
 * reading or writing formats ImageIO has no plugin for, like webp.
 */
class Magick {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final String executable;

	Magick(String executable) {
		this.executable = executable;
	}

	/**
	 * converts the image, applying the given options between the input and the output.
	 */
	byte[] convert(byte[] image, String inputFormat, String outputFormat, String... options)
			throws IOException, InterruptedException {
		var directory = FileUtils.createWorkingDirectory("magick");
		try {
			var input = FileUtils.write(directory, "input." + inputFormat, image);
			var output = directory.resolve("output." + outputFormat);
			var command = new ArrayList<String>();
			command.add(this.executable);
			command.add(input.toAbsolutePath().toString());
			command.addAll(List.of(options));
			command.add(output.toAbsolutePath().toString());
			ProcessUtils.runCommand(command);
			var bytes = Files.readAllBytes(output);
			this.log.debug("converted {} bytes of {} into {} bytes of {}", image.length, inputFormat, bytes.length,
					outputFormat);
			return bytes;
		} //
		finally {
			FileUtils.delete(directory);
		}
	}

}

package com.joshlong.mediaops.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public abstract class FileUtils {

	private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

	/**
	 * a fresh, empty directory for the scratch files of one tool invocation. Remove it
	 * with {@link #delete(Path)}.
	 */
	public static Path createWorkingDirectory(String prefix) throws IOException {
		return Files.createTempDirectory("mediaops-" + prefix + "-");
	}

	/**
	 * writes the bytes to a file called {@code name} inside {@code directory}.
	 */
	public static Path write(Path directory, String name, byte[] bytes) throws IOException {
		var file = directory.resolve(name);
		Files.write(file, bytes);
		return file;
	}

	public static void delete(Path path) {
		if (path == null)
			return;
		try {
			FileSystemUtils.deleteRecursively(path);
		} //
		catch (IOException e) {
			log.warn("could not delete [{}]", path, e);
		}
	}

	public static void delete(File file) {
		if (file != null)
			delete(file.toPath());
	}

	/**
	 * @return the lowercase extension of a key or file name, without the dot, or
	 * {@code null} if there is none
	 */
	public static String extension(String name) {
		if (name == null)
			return null;
		var slash = name.lastIndexOf('/');
		var dot = name.lastIndexOf('.');
		if (dot == -1 || dot < slash || dot == name.length() - 1)
			return null;
		return name.substring(dot + 1).toLowerCase(Locale.ROOT);
	}

	/**
	 * @return the name of a key without its directories and extension
	 */
	public static String baseName(String name) {
		var slash = name.lastIndexOf('/');
		var file = name.substring(slash + 1);
		var dot = file.lastIndexOf('.');
		return dot <= 0 ? file : file.substring(0, dot);
	}

}

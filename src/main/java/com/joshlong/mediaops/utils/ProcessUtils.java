package com.joshlong.mediaops.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileCopyUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * runs external tools like {@code ffmpeg} or {@code magick}.
 */
public abstract class ProcessUtils {

	private static final Logger log = LoggerFactory.getLogger(ProcessUtils.class);

	/**
	 * what a finished process wrote, and how it exited.
	 */
	public record Result(int exitCode, byte[] stdout, String stderr) {

		public boolean succeeded() {
			return this.exitCode == 0;
		}

		public String stdoutAsString() {
			return new String(this.stdout, StandardCharsets.UTF_8);
		}
	}

	/**
	 * thrown when a process exits with anything but zero. The message carries what the
	 * process wrote to stderr.
	 */
	public static class ProcessFailedException extends IOException {

		private final int exitCode;

		public ProcessFailedException(String command, int exitCode, String stderr) {
			super("[" + command + "] exited with " + exitCode + (stderr == null || stderr.isBlank() ? "" : ": " + stderr.trim()));
			this.exitCode = exitCode;
		}

		public int exitCode() {
			return this.exitCode;
		}

	}

	/**
	 * runs the command and waits for it. If the waiting thread is interrupted, or anything
	 * else stops the wait, the process is killed.
	 */
	public static Result run(List<String> command, File workingDirectory) throws IOException, InterruptedException {
		log.debug("running {}", command);
		var builder = new ProcessBuilder(command);
		if (workingDirectory != null)
			builder.directory(workingDirectory);
		var process = builder.start();
		var completed = false;
		try {
			process.getOutputStream().close();
			var stderr = CompletableFuture.supplyAsync(() -> {
				try (var reader = new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8)) {
					return FileCopyUtils.copyToString(reader);
				} //
				catch (IOException e) {
					return "could not read stderr: " + e.getMessage();
				}
			});
			var stdout = CompletableFuture.supplyAsync(() -> {
				try {
					return FileCopyUtils.copyToByteArray(process.getInputStream());
				} //
				catch (IOException e) {
					throw new UncheckedIOException(e);
				}
			});
			var exit = process.waitFor();
			var result = new Result(exit, join(stdout), stderr.join());
			completed = true;
			return result;
		} //
		finally {
			if (!completed) {
				log.debug("killing {}", command);
				process.destroyForcibly();
			}
		}
	}

	private static byte[] join(CompletableFuture<byte[]> stdout) throws IOException {
		try {
			return stdout.join();
		} //
		catch (CompletionException e) {
			if (e.getCause() instanceof UncheckedIOException uio)
				throw uio.getCause();
			throw e;
		}
	}

	/**
	 * runs the command and fails unless it exits with zero.
	 */
	public static Result runCommand(List<String> command) throws IOException, InterruptedException {
		var result = run(command, null);
		if (!result.succeeded())
			throw new ProcessFailedException(String.join(" ", command), result.exitCode(), result.stderr());
		return result;
	}

	public static Result runCommand(String... command) throws IOException, InterruptedException {
		return runCommand(List.of(command));
	}

}

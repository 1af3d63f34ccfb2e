package com.joshlong.mediaops;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;

@ConfigurationProperties(prefix = "mediaops")
public record MediaOpsProperties(Aws aws, Storage storage, Tasks tasks, Notifications notifications, Media media,
		boolean debug) {

	public record Aws(String accessKey, String accessKeySecret, String region, URI endpoint) {
	}

	/**
	 * @param bucket where sources are read from
	 * @param targetBucket where asynchronous results are written
	 * @param targetPrefix the key prefix of asynchronous results
	 */
	public record Storage(String bucket, String targetBucket, String targetPrefix) {
	}

	/**
	 * @param timeout the wall-clock budget of one asynchronous pipeline
	 * @param workers how many asynchronous pipelines may run at once
	 */
	public record Tasks(Duration timeout, int workers) {
	}

	/**
	 * @param topicArn the SNS topic alerted when a task ends up in the dead letter channel.
	 * If it's empty, alerts are only logged.
	 */
	public record Notifications(String topicArn) {
	}

	public record Media(String cacheControl, Tools tools) {

		public record Tools(String magick, String ffmpeg, String ffprobe, String soffice, String pdftoppm,
				String pdftotext, String pdfinfo) {
		}
	}
}

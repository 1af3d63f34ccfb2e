package com.joshlong.mediaops;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sns.SnsClient;

@Configuration
class AwsConfiguration {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private static AwsCredentialsProvider credentials(MediaOpsProperties.Aws aws) {
		if (aws.accessKey() == null || aws.accessKey().isBlank())
			return DefaultCredentialsProvider.create();
		return StaticCredentialsProvider.create(AwsBasicCredentials.create(aws.accessKey(), aws.accessKeySecret()));
	}

	@Bean
	S3Client s3Client(MediaOpsProperties properties) {
		var aws = properties.aws();
		var builder = S3Client.builder()
			.region(Region.of(aws.region()))
			.credentialsProvider(credentials(aws))
			.forcePathStyle(true);
		if (aws.endpoint() != null)
			builder = builder.endpointOverride(aws.endpoint());
		return builder.build();
	}

	@Bean
	SnsClient snsClient(MediaOpsProperties properties) {
		var aws = properties.aws();
		var builder = SnsClient.builder() //
			.region(Region.of(aws.region())) //
			.credentialsProvider(credentials(aws));
		if (aws.endpoint() != null)
			builder = builder.endpointOverride(aws.endpoint());
		return builder.build();
	}

	@Bean
	InitializingBean validateS3(MediaOpsProperties properties, S3Client s3) {
		return () -> {
			if (!properties.debug())
				return;
			s3.listBuckets().buckets().forEach(bucket -> this.log.debug("found the bucket [{}]", bucket.name()));
		};
	}

}

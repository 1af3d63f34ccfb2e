package com.joshlong.mediaops.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
class S3ObjectStore implements ObjectStore {

	/**
	 * objects larger than this are uploaded in parts of this size.
	 */
	static final DataSize PART_SIZE = DataSize.ofMegabytes(10);

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final Set<String> knownBuckets = ConcurrentHashMap.newKeySet();

	private final S3Client s3;

	S3ObjectStore(S3Client s3) {
		this.s3 = s3;
	}

	@Override
	public byte[] fetch(String bucket, String key) {
		try {
			var request = GetObjectRequest.builder().bucket(bucket).key(key).build();
			var bytes = this.s3.getObjectAsBytes(request).asByteArray();
			this.log.debug("read {} bytes from [{}/{}]", bytes.length, bucket, key);
			return bytes;
		} //
		catch (NoSuchKeyException | NoSuchBucketException e) {
			throw new ObjectNotFoundException(bucket, key);
		} //
		catch (S3Exception e) {
			if (e.statusCode() == 404)
				throw new ObjectNotFoundException(bucket, key);
			throw e;
		}
	}

	@Override
	public URI put(String bucket, String key, byte[] bytes, String contentType) {
		this.log.info("started executing an S3 PUT for [{}/{}] on thread [{}]", bucket, key, Thread.currentThread());
		this.ensureBucketExists(bucket);
		var chunkSize = (int) PART_SIZE.toBytes();
		if (bytes.length <= chunkSize) {
			var request = PutObjectRequest.builder().bucket(bucket).key(key).contentType(contentType).build();
			this.s3.putObject(request, RequestBody.fromBytes(bytes));
		}
		else {
			this.doWriteForLargeFiles(bucket, key, bytes, chunkSize, contentType);
		}
		return URI.create("s3://" + bucket + "/" + key);
	}

	/*
	 * writes N-mb sized chunks at a time to s3
	 */
	private void doWriteForLargeFiles(String bucket, String key, byte[] bytes, int chunkSize, String contentType) {
		var create = CreateMultipartUploadRequest.builder().bucket(bucket).key(key).contentType(contentType).build();
		var uploadId = this.s3.createMultipartUpload(create).uploadId();
		var completedParts = new ArrayList<CompletedPart>();
		var partNumber = 1;
		for (var offset = 0; offset < bytes.length; offset += chunkSize) {
			this.log.trace("uploading part [{}]", partNumber);
			var part = Arrays.copyOfRange(bytes, offset, Math.min(bytes.length, offset + chunkSize));
			var uploadPartRequest = UploadPartRequest.builder()
				.bucket(bucket)
				.key(key)
				.uploadId(uploadId)
				.partNumber(partNumber)
				.build();
			var etag = this.s3.uploadPart(uploadPartRequest, RequestBody.fromBytes(part)).eTag();
			completedParts.add(CompletedPart.builder().partNumber(partNumber).eTag(etag).build());
			partNumber++;
		}
		var complete = CompleteMultipartUploadRequest.builder()
			.bucket(bucket)
			.key(key)
			.uploadId(uploadId)
			.multipartUpload(CompletedMultipartUpload.builder().parts(completedParts).build())
			.build();
		this.s3.completeMultipartUpload(complete);
	}

	private void ensureBucketExists(String bucket) {
		if (this.knownBuckets.contains(bucket))
			return;
		try {
			this.s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
			this.log.trace("the bucket named [{}] already exists", bucket);
		} //
		catch (NoSuchBucketException e) {
			this.log.info("attempting to create the bucket called [{}]", bucket);
			this.s3.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
		}
		this.knownBuckets.add(bucket);
	}

}

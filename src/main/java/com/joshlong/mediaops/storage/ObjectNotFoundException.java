package com.joshlong.mediaops.storage;

public class ObjectNotFoundException extends RuntimeException {

	private final String bucket;

	private final String key;

	public ObjectNotFoundException(String bucket, String key) {
		super("there is no object [" + key + "] in the bucket [" + bucket + "]");
		this.bucket = bucket;
		this.key = key;
	}

	public String bucket() {
		return this.bucket;
	}

	public String key() {
		return this.key;
	}

}

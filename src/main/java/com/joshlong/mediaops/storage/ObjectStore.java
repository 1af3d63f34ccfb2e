package com.joshlong.mediaops.storage;

import java.net.URI;

/**
 * where sources are read from and results are written to.
 */
public interface ObjectStore {

	/**
	 * @throws ObjectNotFoundException if there is no such object
	 */
	byte[] fetch(String bucket, String key);

	/**
	 * writes the bytes, creating the bucket if needed.
	 * @return the location of the written object
	 */
	URI put(String bucket, String key, byte[] bytes, String contentType);

}

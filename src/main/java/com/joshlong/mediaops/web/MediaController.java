package com.joshlong.mediaops.web;

import com.joshlong.mediaops.MediaOpsProperties;
import com.joshlong.mediaops.media.MediaService;
import com.joshlong.mediaops.operations.MediaKind;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * runs a pipeline over an object while the caller waits, answering with the resulting
 * bytes.
 */
@RestController
class MediaController {

	private static final String MEDIA_URL = "/media/{kind}/{*key}";

	private final MediaService mediaService;

	private final String cacheControl;

	MediaController(MediaService mediaService, MediaOpsProperties properties) {
		this.mediaService = mediaService;
		this.cacheControl = properties.media().cacheControl();
	}

	@GetMapping(MEDIA_URL)
	ResponseEntity<byte[]> process(@PathVariable String kind, @PathVariable String key,
			@RequestParam(required = false) String operations) {
		var result = this.mediaService.process(MediaKind.of(kind), Keys.normalize(key), operations);
		return ResponseEntity.ok() //
			.contentType(MediaType.parseMediaType(result.contentType())) //
			.header(HttpHeaders.CACHE_CONTROL, this.cacheControl) //
			.eTag(result.etag()) //
			.body(result.artifact());
	}

}

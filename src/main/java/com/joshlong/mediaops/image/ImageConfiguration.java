package com.joshlong.mediaops.image;

import com.joshlong.mediaops.MediaOpsProperties;
import com.joshlong.mediaops.validation.MediaSchema;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class ImageConfiguration {

	@Bean
	MediaSchema imageMediaSchema() {
		return ImageSchemas.SCHEMA;
	}

	@Bean
	ImageOperationHandlers imageOperationHandlers(MediaOpsProperties properties) {
		var magick = new Magick(properties.media().tools().magick());
		return new ImageOperationHandlers(new ImageCodec(magick), magick);
	}

}

package com.joshlong.mediaops.video;

import com.joshlong.mediaops.MediaOpsProperties;
import com.joshlong.mediaops.validation.MediaSchema;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class VideoConfiguration {

	@Bean
	MediaSchema videoMediaSchema() {
		return VideoSchemas.SCHEMA;
	}

	@Bean
	VideoOperationHandlers videoOperationHandlers(MediaOpsProperties properties) {
		var tools = properties.media().tools();
		return new VideoOperationHandlers(tools.ffmpeg(), new VideoProbe(tools.ffprobe()));
	}

}

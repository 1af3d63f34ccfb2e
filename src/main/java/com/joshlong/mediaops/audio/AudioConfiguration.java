package com.joshlong.mediaops.audio;

import com.joshlong.mediaops.MediaOpsProperties;
import com.joshlong.mediaops.validation.MediaSchema;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class AudioConfiguration {

	@Bean
	MediaSchema audioMediaSchema() {
		return AudioSchemas.SCHEMA;
	}

	@Bean
	AudioOperationHandlers audioOperationHandlers(MediaOpsProperties properties) {
		return new AudioOperationHandlers(properties.media().tools().ffmpeg());
	}

}

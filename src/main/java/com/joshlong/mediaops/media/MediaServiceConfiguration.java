package com.joshlong.mediaops.media;

import com.joshlong.mediaops.MediaOpsProperties;
import com.joshlong.mediaops.execution.PipelineExecutor;
import com.joshlong.mediaops.operations.OperationsParser;
import com.joshlong.mediaops.storage.ObjectStore;
import com.joshlong.mediaops.validation.PipelineValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class MediaServiceConfiguration {

	@Bean
	DefaultMediaService mediaService(OperationsParser parser, PipelineValidator validator, PipelineExecutor executor,
			ObjectStore objectStore, MediaOpsProperties properties) {
		return new DefaultMediaService(parser, validator, executor, objectStore, properties.storage().bucket());
	}

}

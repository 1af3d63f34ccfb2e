package com.joshlong.mediaops.documents;

import com.joshlong.mediaops.MediaOpsProperties;
import com.joshlong.mediaops.validation.MediaSchema;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class DocumentConfiguration {

	@Bean
	MediaSchema documentMediaSchema() {
		return DocumentSchemas.SCHEMA;
	}

	@Bean
	DocumentOperationHandlers documentOperationHandlers(MediaOpsProperties properties) {
		return new DocumentOperationHandlers(new DocumentConverter(properties.media().tools()));
	}

}

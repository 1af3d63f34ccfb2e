package com.joshlong.mediaops.validation;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
class ValidationConfiguration {

	@Bean
	SchemaRegistry schemaRegistry(List<MediaSchema> schemas) {
		return new SchemaRegistry(schemas);
	}

}

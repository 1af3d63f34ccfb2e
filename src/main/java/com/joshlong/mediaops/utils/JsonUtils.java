package com.joshlong.mediaops.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.Role;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * have Spring create an instance of this and we'll capture the {@link ObjectMapper om} in
 * a static variable. Until then, a default mapper is used.
 */
@Component
@Role(BeanDefinition.ROLE_INFRASTRUCTURE)
public class JsonUtils {

	private static final AtomicReference<ObjectMapper> OBJECT_MAPPER_ATOMIC_REFERENCE = new AtomicReference<>(
			new ObjectMapper().findAndRegisterModules());

	JsonUtils(ObjectMapper objectMapper) {
		OBJECT_MAPPER_ATOMIC_REFERENCE.set(objectMapper);
	}

	public static <T> T read(String json, TypeReference<T> typeReference) {
		try {
			return OBJECT_MAPPER_ATOMIC_REFERENCE.get().readValue(json, typeReference);
		} //
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("could not read the JSON", e);
		}
	}

	public static <T> T read(String json, Class<T> clzz) {
		try {
			return OBJECT_MAPPER_ATOMIC_REFERENCE.get().readValue(json, clzz);
		} //
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("could not read the JSON", e);
		}
	}

	public static JsonNode tree(String json) {
		try {
			return OBJECT_MAPPER_ATOMIC_REFERENCE.get().readTree(json);
		} //
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("could not read the JSON", e);
		}
	}

	public static String write(Object o) {
		try {
			return OBJECT_MAPPER_ATOMIC_REFERENCE.get().writeValueAsString(o);
		} //
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("could not write the JSON", e);
		}
	}

}

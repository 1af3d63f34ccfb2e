package com.joshlong.mediaops.web;

import org.springframework.util.StringUtils;

abstract class Keys {

	/**
	 * a {@code {*key}} path variable starts with a slash, object keys don't.
	 */
	static String normalize(String key) {
		var trimmed = StringUtils.trimLeadingCharacter(key == null ? "" : key, '/');
		if (!StringUtils.hasText(trimmed))
			throw new IllegalArgumentException("the object key must not be empty");
		return trimmed;
	}

}

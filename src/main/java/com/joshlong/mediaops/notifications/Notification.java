package com.joshlong.mediaops.notifications;

import java.util.Map;

/**
 * an alert for operators.
 *
 * @param subject a one-line summary
 * @param message the body
 * @param attributes structured details, published as JSON alongside the body
 */
public record Notification(String subject, String message, Map<String, Object> attributes) {

	public Notification {
		attributes = Map.copyOf(attributes);
	}

}

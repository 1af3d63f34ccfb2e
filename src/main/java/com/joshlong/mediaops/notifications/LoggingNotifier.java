package com.joshlong.mediaops.notifications;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * used when no SNS topic is configured.
 */
class LoggingNotifier implements Notifier {

	private final Logger log = LoggerFactory.getLogger(getClass());

	@Override
	public void notify(Notification notification) {
		this.log.warn("{}: {} {}", notification.subject(), notification.message(), notification.attributes());
	}

}

package com.joshlong.mediaops.notifications;

import com.joshlong.mediaops.MediaOpsProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.services.sns.SnsClient;

@Configuration
class NotificationsConfiguration {

	@Bean
	Notifier notifier(MediaOpsProperties properties, SnsClient sns) {
		var topic = properties.notifications() == null ? null : properties.notifications().topicArn();
		return StringUtils.hasText(topic) ? new SnsNotifier(sns, topic) : new LoggingNotifier();
	}

}

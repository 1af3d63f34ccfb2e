package com.joshlong.mediaops.notifications;

import com.joshlong.mediaops.utils.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;

import java.util.Map;

/**
 * publishes notifications to an SNS topic. SNS caps subjects at 100 characters.
 */
class SnsNotifier implements Notifier {

	static final int MAX_SUBJECT_LENGTH = 100;

	static final String DETAILS_ATTRIBUTE = "details";

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final SnsClient sns;

	private final String topicArn;

	SnsNotifier(SnsClient sns, String topicArn) {
		this.sns = sns;
		this.topicArn = topicArn;
	}

	@Override
	public void notify(Notification notification) {
		var subject = notification.subject();
		if (subject.length() > MAX_SUBJECT_LENGTH)
			subject = subject.substring(0, MAX_SUBJECT_LENGTH);
		var details = MessageAttributeValue.builder()
			.dataType("String")
			.stringValue(JsonUtils.write(notification.attributes()))
			.build();
		var request = PublishRequest.builder()
			.topicArn(this.topicArn)
			.subject(subject)
			.message(notification.message())
			.messageAttributes(Map.of(DETAILS_ATTRIBUTE, details))
			.build();
		var response = this.sns.publish(request);
		this.log.info("published [{}] to {} as message {}", subject, this.topicArn, response.messageId());
	}

}

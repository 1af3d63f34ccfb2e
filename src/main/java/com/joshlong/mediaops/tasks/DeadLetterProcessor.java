package com.joshlong.mediaops.tasks;

import com.joshlong.mediaops.notifications.Notification;
import com.joshlong.mediaops.notifications.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;

/**
 * makes sure a task whose worker died does not stay {@code processing} forever: if the
 * task isn't terminal yet it is failed, and operators are alerted.
 */
class DeadLetterProcessor {

	static final String SUBJECT_PREFIX = "Media Processing Error: ";

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final TaskStore taskStore;

	private final Notifier notifier;

	DeadLetterProcessor(TaskStore taskStore, Notifier notifier) {
		this.taskStore = taskStore;
		this.notifier = notifier;
	}

	void onMessage(DeadLetter deadLetter) {
		var request = deadLetter.request();
		if (request == null) {
			this.log.error("received a dead letter without a task: [{}] {}", deadLetter.category().label(),
					deadLetter.reason());
			return;
		}
		var taskId = request.taskId();
		var task = this.taskStore.get(taskId);
		if (task.isPresent() && task.get().status().isTerminal()) {
			this.log.info("the task {} is already {}; ignoring its dead letter", taskId, task.get().status().value());
			return;
		}
		if (task.isEmpty()) {
			this.log.warn("there is no record of the dead task {}; creating one", taskId);
			this.taskStore.create(new Task(taskId, TaskStatus.PROCESSING, request.pipeline().kind().taskType(),
					request.sourceBucket(), request.sourceKey(), request.targetBucket(), request.targetKey(),
					request.operations(), null, null, null));
		}
		var message = "[" + deadLetter.category().label() + "] " + deadLetter.reason();
		if (!this.taskStore.fail(taskId, message)) {
			this.log.info("the task {} became terminal before its dead letter was handled", taskId);
			return;
		}
		this.log.warn("failed the task {} from the dead letter channel: {}", taskId, message);
		var attributes = new LinkedHashMap<String, Object>();
		attributes.put("taskId", taskId);
		attributes.put("category", deadLetter.category().label());
		attributes.put("taskType", request.pipeline().kind().taskType());
		attributes.put("sourceBucket", request.sourceBucket());
		attributes.put("sourceKey", request.sourceKey());
		attributes.put("error", deadLetter.reason());
		this.notifier.notify(new Notification(SUBJECT_PREFIX + taskId, message, attributes));
	}

}

package com.joshlong.mediaops.tasks;

import org.springframework.messaging.MessagingException;

/**
 * a task whose worker failed outside the pipeline's own error reporting.
 *
 * @param request the original request, or {@code null} if it could not be recovered
 * @param category what kind of failure it was
 * @param reason a description of the failure
 */
record DeadLetter(TaskExecutionRequest request, InfrastructureException.Category category, String reason) {

	static DeadLetter from(Throwable throwable) {
		TaskExecutionRequest request = null;
		for (var t = throwable; t != null && request == null; t = t.getCause()) {
			if (t instanceof MessagingException me && me.getFailedMessage() != null
					&& me.getFailedMessage().getPayload() instanceof TaskExecutionRequest ter)
				request = ter;
		}
		return new DeadLetter(request, InfrastructureException.Category.of(throwable), describe(throwable));
	}

	private static String describe(Throwable throwable) {
		var deepest = throwable;
		for (var t = throwable; t != null; t = t.getCause()) {
			if (t instanceof InfrastructureException)
				return t.getMessage();
			deepest = t;
		}
		return deepest.getMessage() == null ? deepest.getClass().getSimpleName() : deepest.getMessage();
	}

}

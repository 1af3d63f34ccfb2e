package com.joshlong.mediaops.tasks;

/**
 * the acknowledgement of a submission. A submission whose operations don't parse or
 * validate is still recorded, already {@code failed}.
 */
public record TaskSubmission(String taskId, TaskStatus status, String message) {
}

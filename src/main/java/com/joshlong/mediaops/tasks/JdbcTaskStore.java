package com.joshlong.mediaops.tasks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.util.Assert;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.Optional;

class JdbcTaskStore implements TaskStore {

	/**
	 * error messages are truncated to fit the column.
	 */
	static final int MAX_ERROR_MESSAGE_LENGTH = 4000;

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final TaskRowMapper taskRowMapper = new TaskRowMapper();

	private final JdbcClient db;

	private final Clock clock;

	JdbcTaskStore(JdbcClient db, Clock clock) {
		this.db = db;
		this.clock = clock;
	}

	@Override
	public void create(Task task) {
		Assert.state(task.status() == TaskStatus.PROCESSING, "a task must start out processing");
		var now = Timestamp.from(this.clock.instant());
		this.db.sql("""
				insert into media_task (task_id, status, task_type, source_bucket, source_key, target_bucket,
				    target_key, operations, created_at, updated_at)
				values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
				""")
			.params(task.taskId(), task.status().value(), task.taskType(), task.sourceBucket(), task.sourceKey(),
					task.targetBucket(), task.targetKey(), task.operations(), now, now)
			.update();
		this.log.debug("created the task {} for [{}/{}]", task.taskId(), task.sourceBucket(), task.sourceKey());
	}

	@Override
	public Optional<Task> get(String taskId) {
		return this.db.sql("select * from media_task where task_id = ?")
			.param(taskId)
			.query(this.taskRowMapper)
			.optional();
	}

	@Override
	public boolean complete(String taskId, String targetKey) {
		var updated = this.db.sql("""
				update media_task set status = ?, target_key = ?, updated_at = ?
				where task_id = ? and status = ?
				""")
			.params(TaskStatus.COMPLETED.value(), targetKey, Timestamp.from(this.clock.instant()), taskId,
					TaskStatus.PROCESSING.value())
			.update();
		this.log.debug("completing the task {}: {}", taskId, updated == 1 ? "done" : "it is already terminal");
		return updated == 1;
	}

	@Override
	public boolean fail(String taskId, String errorMessage) {
		var message = errorMessage == null || errorMessage.isBlank() ? "unknown error" : errorMessage;
		if (message.length() > MAX_ERROR_MESSAGE_LENGTH)
			message = message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
		var updated = this.db.sql("""
				update media_task set status = ?, error_message = ?, updated_at = ?
				where task_id = ? and status = ?
				""")
			.params(TaskStatus.FAILED.value(), message, Timestamp.from(this.clock.instant()), taskId,
					TaskStatus.PROCESSING.value())
			.update();
		this.log.debug("failing the task {}: {}", taskId, updated == 1 ? "done" : "it is already terminal");
		return updated == 1;
	}

}

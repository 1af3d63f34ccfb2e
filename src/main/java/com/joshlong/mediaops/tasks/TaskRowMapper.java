package com.joshlong.mediaops.tasks;

import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

class TaskRowMapper implements RowMapper<Task> {

	@Override
	public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
		return new Task(rs.getString("task_id"), //
				TaskStatus.of(rs.getString("status")), //
				rs.getString("task_type"), //
				rs.getString("source_bucket"), //
				rs.getString("source_key"), //
				rs.getString("target_bucket"), //
				rs.getString("target_key"), //
				rs.getString("operations"), //
				rs.getTimestamp("created_at").toInstant(), //
				rs.getTimestamp("updated_at").toInstant(), //
				rs.getString("error_message"));
	}

}

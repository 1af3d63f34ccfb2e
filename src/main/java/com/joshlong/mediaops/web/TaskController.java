package com.joshlong.mediaops.web;

import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.tasks.Task;
import com.joshlong.mediaops.tasks.TaskService;
import com.joshlong.mediaops.tasks.TaskSubmission;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
class TaskController {

	private static final String SUBMIT_URL = "/tasks/{kind}/{*key}";

	private static final String STATUS_URL = "/tasks/{taskId}";

	private final TaskService taskService;

	TaskController(TaskService taskService) {
		this.taskService = taskService;
	}

	@PostMapping(SUBMIT_URL)
	ResponseEntity<TaskSubmission> submit(@PathVariable String kind, @PathVariable String key,
			@RequestParam(required = false) String operations) {
		var submission = this.taskService.submit(MediaKind.of(kind), Keys.normalize(key), operations);
		return ResponseEntity.status(HttpStatus.ACCEPTED).body(submission);
	}

	@GetMapping(STATUS_URL)
	Task status(@PathVariable String taskId) {
		return this.taskService.status(taskId);
	}

}

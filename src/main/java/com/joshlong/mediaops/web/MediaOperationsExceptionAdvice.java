package com.joshlong.mediaops.web;

import com.joshlong.mediaops.execution.PipelineExecutionException;
import com.joshlong.mediaops.operations.OperationParseException;
import com.joshlong.mediaops.storage.ObjectNotFoundException;
import com.joshlong.mediaops.tasks.TaskNotFoundException;
import com.joshlong.mediaops.validation.OperationValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseBody;

/**
 * parse and validation failures are the caller's fault, pipeline failures are ours, and
 * unknown objects or tasks are simply not found.
 */
@ControllerAdvice
@ResponseBody
class MediaOperationsExceptionAdvice {

	private final Logger log = LoggerFactory.getLogger(getClass());

	@ExceptionHandler
	ProblemDetail handleParseError(OperationParseException ex) {
		var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
		problem.setTitle("Malformed operations");
		problem.setProperty("stage", ex.position());
		return problem;
	}

	@ExceptionHandler
	ProblemDetail handleValidationError(OperationValidationException ex) {
		var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
		problem.setTitle("Invalid operations");
		problem.setProperty("operation", ex.operation());
		problem.setProperty("key", ex.key());
		problem.setProperty("reason", ex.reason());
		return problem;
	}

	@ExceptionHandler
	ProblemDetail handleExecutionError(PipelineExecutionException ex) {
		this.log.error("a pipeline failed", ex);
		var problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
		problem.setTitle("Processing failed");
		problem.setProperty("stage", ex.position());
		problem.setProperty("operation", ex.operation());
		if (ex.getCause() != null)
			problem.setProperty("cause", ex.getCause().getMessage());
		return problem;
	}

	@ExceptionHandler
	ProblemDetail handleObjectNotFound(ObjectNotFoundException ex) {
		var problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
		problem.setTitle("Object not found");
		problem.setProperty("key", ex.key());
		return problem;
	}

	@ExceptionHandler
	ProblemDetail handleTaskNotFound(TaskNotFoundException ex) {
		var problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
		problem.setTitle("Task not found");
		problem.setProperty("taskId", ex.taskId());
		return problem;
	}

	@ExceptionHandler
	ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
		var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
		problem.setTitle("Bad request");
		return problem;
	}

}

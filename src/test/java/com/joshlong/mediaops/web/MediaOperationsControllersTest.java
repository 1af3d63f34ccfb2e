package com.joshlong.mediaops.web;

import com.joshlong.mediaops.MediaOpsProperties;
import com.joshlong.mediaops.execution.ExecutionResult;
import com.joshlong.mediaops.execution.MediaMetadata;
import com.joshlong.mediaops.execution.PipelineExecutionException;
import com.joshlong.mediaops.media.MediaService;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.operations.OperationParseException;
import com.joshlong.mediaops.storage.ObjectNotFoundException;
import com.joshlong.mediaops.tasks.Task;
import com.joshlong.mediaops.tasks.TaskNotFoundException;
import com.joshlong.mediaops.tasks.TaskService;
import com.joshlong.mediaops.tasks.TaskStatus;
import com.joshlong.mediaops.tasks.TaskSubmission;
import com.joshlong.mediaops.validation.OperationValidationException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MediaOperationsControllersTest {

	private final MediaService mediaService = Mockito.mock(MediaService.class);

	private final TaskService taskService = Mockito.mock(TaskService.class);

	private final MockMvc mvc;

	MediaOperationsControllersTest() {
		var properties = new MediaOpsProperties(null, null, null, null,
				new MediaOpsProperties.Media("public, max-age=3600", null), false);
		this.mvc = MockMvcBuilders
			.standaloneSetup(new MediaController(this.mediaService, properties), new TaskController(this.taskService))
			.setControllerAdvice(new MediaOperationsExceptionAdvice())
			.build();
	}

	@Test
	void processedMediaIsReturnedWithCachingHeaders() throws Exception {
		var bytes = new byte[] { 1, 2, 3 };
		Mockito.when(this.mediaService.process(MediaKind.IMAGE, "photos/cat.jpg", "resize,w_800"))
			.thenReturn(new ExecutionResult(bytes, MediaMetadata.of("jpg"), "image/jpeg", "0123abcd", List.of()));
		this.mvc.perform(get("/media/image/photos/cat.jpg").param("operations", "resize,w_800"))
			.andExpect(status().isOk())
			.andExpect(content().contentType(MediaType.IMAGE_JPEG))
			.andExpect(content().bytes(bytes))
			.andExpect(header().string(HttpHeaders.CACHE_CONTROL, "public, max-age=3600"))
			.andExpect(header().string(HttpHeaders.ETAG, "\"0123abcd\""));
	}

	@Test
	void malformedOperationsAreTheCallersFault() throws Exception {
		Mockito.when(this.mediaService.process(MediaKind.IMAGE, "cat.jpg", "resize,w_1//"))
			.thenThrow(new OperationParseException(1, "the stage is empty"));
		this.mvc.perform(get("/media/image/cat.jpg").param("operations", "resize,w_1//"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.stage").value(1));
	}

	@Test
	void invalidOperationsAreTheCallersFault() throws Exception {
		Mockito.when(this.mediaService.process(MediaKind.AUDIO, "a.wav", "convert,f_mp3,aq_90,ab_96000"))
			.thenThrow(new OperationValidationException("convert", "ab", "can not be combined with [aq]"));
		this.mvc.perform(get("/media/audio/a.wav").param("operations", "convert,f_mp3,aq_90,ab_96000"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.operation").value("convert"))
			.andExpect(jsonPath("$.key").value("ab"))
			.andExpect(jsonPath("$.reason").value("can not be combined with [aq]"));
	}

	@Test
	void failedPipelinesAreOurFault() throws Exception {
		Mockito.when(this.mediaService.process(MediaKind.DOCUMENT, "notes.xyz", "convert,target_pdf"))
			.thenThrow(new PipelineExecutionException(0, "convert", new IllegalArgumentException("unsupported")));
		this.mvc.perform(get("/media/doc/notes.xyz").param("operations", "convert,target_pdf"))
			.andExpect(status().isInternalServerError())
			.andExpect(jsonPath("$.stage").value(0))
			.andExpect(jsonPath("$.operation").value("convert"));
	}

	@Test
	void missingObjectsAreNotFound() throws Exception {
		Mockito.when(this.mediaService.process(MediaKind.VIDEO, "clip.mp4", "snapshot"))
			.thenThrow(new ObjectNotFoundException("sources", "clip.mp4"));
		this.mvc.perform(get("/media/video/clip.mp4").param("operations", "snapshot"))
			.andExpect(status().isNotFound());
	}

	@Test
	void unknownMediaKindsAreRejected() throws Exception {
		this.mvc.perform(get("/media/hologram/x.bin")).andExpect(status().isBadRequest());
		Mockito.verifyNoInteractions(this.mediaService);
	}

	@Test
	void submissionsAreAccepted() throws Exception {
		Mockito.when(this.taskService.submit(MediaKind.AUDIO, "music/song.wav", "convert,f_mp3"))
			.thenReturn(new TaskSubmission("t-1", TaskStatus.PROCESSING, "the task has been accepted and is processing"));
		this.mvc.perform(post("/tasks/audio/music/song.wav").param("operations", "convert,f_mp3"))
			.andExpect(status().isAccepted())
			.andExpect(jsonPath("$.taskId").value("t-1"))
			.andExpect(jsonPath("$.status").value("processing"));
	}

	@Test
	void tasksCanBePolled() throws Exception {
		var now = Instant.parse("2024-05-01T10:15:30Z");
		Mockito.when(this.taskService.status("t-1"))
			.thenReturn(new Task("t-1", TaskStatus.COMPLETED, "audio/process", "sources", "music/song.wav",
					"results", "output/t-1/song.mp3", "convert,f_mp3", now, now, null));
		this.mvc.perform(get("/tasks/t-1"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.status").value("completed"))
			.andExpect(jsonPath("$.targetKey").value("output/t-1/song.mp3"));
	}

	@Test
	void unknownTasksAreNotFound() throws Exception {
		Mockito.when(this.taskService.status("nope")).thenThrow(new TaskNotFoundException("nope"));
		this.mvc.perform(get("/tasks/nope"))
			.andExpect(status().isNotFound())
			.andExpect(jsonPath("$.taskId").value("nope"));
	}

}

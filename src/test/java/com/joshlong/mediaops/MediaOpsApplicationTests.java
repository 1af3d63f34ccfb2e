package com.joshlong.mediaops;

import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.storage.ObjectStore;
import com.joshlong.mediaops.tasks.TaskService;
import com.joshlong.mediaops.tasks.TaskStatus;
import com.joshlong.mediaops.validation.SchemaRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.modulith.core.ApplicationModules;
import org.springframework.modulith.docs.Documenter;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest(properties = { "spring.datasource.url=jdbc:h2:mem:mediaops;DB_CLOSE_DELAY=-1",
		"spring.datasource.username=sa", "spring.datasource.password=" })
class MediaOpsApplicationTests {

	@MockitoBean
	private ObjectStore objectStore;

	@Test
	void modules() {
		var am = ApplicationModules.of(MediaOpsApplication.class);
		am.verify();
		new Documenter(am).writeDocumentation();
	}

	@Test
	void everyMediaKindHasASchema(@Autowired SchemaRegistry registry) {
		for (var kind : MediaKind.values())
			Assertions.assertEquals(kind, registry.schema(kind).kind());
	}

	@Test
	void rejectedSubmissionsAreRecorded(@Autowired TaskService taskService) {
		var submission = taskService.submit(MediaKind.AUDIO, "music/song.wav", "convert,f_mp3,aq_90,ab_96000");
		Assertions.assertEquals(TaskStatus.FAILED, submission.status());
		var task = taskService.status(submission.taskId());
		Assertions.assertEquals(TaskStatus.FAILED, task.status());
		Assertions.assertEquals("audio/process", task.taskType());
		Assertions.assertNotNull(task.errorMessage());
	}

	@Test
	void aWorkerThatDiesFailsItsTaskThroughTheDeadLetterChannel(@Autowired TaskService taskService)
			throws Exception {
		Mockito.when(this.objectStore.fetch(ArgumentMatchers.anyString(), ArgumentMatchers.eq("music/huge.wav")))
			.thenThrow(new OutOfMemoryError("Java heap space"));
		var submission = taskService.submit(MediaKind.AUDIO, "music/huge.wav", "convert,f_mp3");
		Assertions.assertEquals(TaskStatus.PROCESSING, submission.status());
		var deadline = System.currentTimeMillis() + 10_000;
		var task = taskService.status(submission.taskId());
		while (task.status() == TaskStatus.PROCESSING && System.currentTimeMillis() < deadline) {
			Thread.sleep(50);
			task = taskService.status(submission.taskId());
		}
		Assertions.assertEquals(TaskStatus.FAILED, task.status());
		Assertions.assertTrue(task.errorMessage().startsWith("[MEMORY LIMIT]"), task.errorMessage());
	}

}

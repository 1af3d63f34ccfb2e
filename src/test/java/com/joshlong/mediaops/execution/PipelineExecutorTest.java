package com.joshlong.mediaops.execution;

import com.joshlong.mediaops.operations.ImageOperation;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.validation.Pipeline;
import com.joshlong.mediaops.validation.Stage;
import com.joshlong.mediaops.validation.StageParameters;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

class PipelineExecutorTest {

	private final List<String> invocations = new ArrayList<>();

	/**
	 * every operation appends its name to the artifact, except {@code blur}, which fails.
	 */
	private final OperationHandlers<ImageOperation> handlers = new OperationHandlers<>() {

		@Override
		public MediaKind kind() {
			return MediaKind.IMAGE;
		}

		@Override
		public Class<ImageOperation> operationType() {
			return ImageOperation.class;
		}

		@Override
		public OperationHandler handlerFor(ImageOperation operation) {
			return (context, parameters) -> {
				invocations.add(operation.operationName());
				if (operation == ImageOperation.BLUR)
					throw new IllegalStateException("the source is corrupt");
				var text = new String(context.artifact(), StandardCharsets.UTF_8) + "|" + operation.operationName();
				var metadata = context.metadata().with("last", operation.operationName());
				return context.withArtifact(text.getBytes(StandardCharsets.UTF_8)).withMetadata(metadata);
			};
		}
	};

	private final PipelineExecutor executor = new PipelineExecutor(List.of(this.handlers));

	private static Stage stage(ImageOperation operation, int position) {
		return new Stage(operation, StageParameters.of(Map.of()), position);
	}

	private static Pipeline pipeline(Stage... stages) {
		return new Pipeline(MediaKind.IMAGE, List.of(stages), "png", "image/png");
	}

	@Test
	void stagesRunInOrderAndThreadTheContext() {
		var result = this.executor.execute(
				pipeline(stage(ImageOperation.RESIZE, 0), stage(ImageOperation.CROP, 1), stage(ImageOperation.ROTATE, 2)),
				MediaContext.of("source".getBytes(StandardCharsets.UTF_8), "jpg"));
		var artifact = new String(result.artifact(), StandardCharsets.UTF_8);
		Assertions.assertEquals("source|resize|crop|rotate", artifact);
		Assertions.assertEquals(List.of("resize", "crop", "rotate"), this.invocations);
		Assertions.assertEquals("rotate", result.metadata().attribute("last").orElseThrow());
		Assertions.assertEquals("png", result.metadata().format());
		Assertions.assertEquals("image/png", result.contentType());
		Assertions.assertEquals(DigestUtils.md5DigestAsHex(result.artifact()), result.etag());
		Assertions.assertFalse(result.isMultiPart());
	}

	@Test
	void theFirstFailureStopsThePipeline() {
		var ex = Assertions.assertThrows(PipelineExecutionException.class,
				() -> this.executor.execute(
						pipeline(stage(ImageOperation.RESIZE, 0), stage(ImageOperation.BLUR, 1),
								stage(ImageOperation.ROTATE, 2)),
						MediaContext.of("source".getBytes(StandardCharsets.UTF_8), "jpg")));
		Assertions.assertEquals(1, ex.position());
		Assertions.assertEquals("blur", ex.operation());
		Assertions.assertInstanceOf(IllegalStateException.class, ex.getCause());
		Assertions.assertTrue(ex.getMessage().contains("the source is corrupt"), ex.getMessage());
		Assertions.assertEquals(List.of("resize", "blur"), this.invocations);
	}

	@Test
	void anEmptyPipelineReturnsTheSource() {
		var source = "source".getBytes(StandardCharsets.UTF_8);
		var result = this.executor.execute(pipeline(), MediaContext.of(source, "png"));
		Assertions.assertArrayEquals(source, result.artifact());
		Assertions.assertEquals(DigestUtils.md5DigestAsHex(source), result.etag());
	}

	@Test
	void pipelinesWithoutHandlersAreRefused() {
		var audio = new Pipeline(MediaKind.AUDIO, List.of(), "mp3", "audio/mpeg");
		Assertions.assertThrows(IllegalStateException.class,
				() -> this.executor.execute(audio, MediaContext.of(new byte[0], "wav")));
	}

}

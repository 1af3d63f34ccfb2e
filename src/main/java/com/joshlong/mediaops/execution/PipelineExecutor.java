package com.joshlong.mediaops.execution;

import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.operations.Operation;
import com.joshlong.mediaops.validation.Pipeline;
import com.joshlong.mediaops.validation.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.DigestUtils;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * runs the stages of a validated {@link Pipeline} in the order they were written, handing
 * each stage the context the previous one produced. The first failure stops the run.
 */
@Component
public class PipelineExecutor {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final Map<MediaKind, OperationHandlers<?>> handlers = new EnumMap<>(MediaKind.class);

	public PipelineExecutor(Collection<OperationHandlers<?>> handlers) {
		for (var h : handlers) {
			Assert.state(!this.handlers.containsKey(h.kind()), () -> "there are two handler sets for " + h.kind());
			this.handlers.put(h.kind(), h);
		}
	}

	public ExecutionResult execute(Pipeline pipeline, MediaContext source) {
		var handlers = this.handlers.get(pipeline.kind());
		Assert.state(handlers != null, () -> "there are no handlers for " + pipeline.kind());
		var context = source
			.withMetadata(source.metadata().with(MediaMetadata.OUTPUT_FORMAT, pipeline.outputFormat()));
		for (var stage : pipeline.stages()) {
			var name = stage.operation().operationName();
			var start = System.currentTimeMillis();
			try {
				var next = resolve(handlers, stage).apply(context, stage.parameters());
				Assert.state(next != null, "the handler returned no context");
				context = next;
			} //
			catch (Exception e) {
				this.log.warn("stage #{} [{}] of a {} pipeline failed", stage.position(), name, pipeline.kind(), e);
				throw new PipelineExecutionException(stage.position(), name, e);
			}
			this.log.debug("stage #{} [{}] {} took {}ms", stage.position(), name, stage.parameters(),
					System.currentTimeMillis() - start);
		}
		var artifact = context.artifact();
		var etag = DigestUtils.md5DigestAsHex(artifact);
		var metadata = context.metadata().withFormat(pipeline.outputFormat());
		return new ExecutionResult(artifact, metadata, pipeline.contentType(), etag, context.parts());
	}

	private static <O extends Enum<O> & Operation> OperationHandler resolve(OperationHandlers<O> handlers,
			Stage stage) {
		return handlers.handlerFor(handlers.operationType().cast(stage.operation()));
	}

}

package com.joshlong.mediaops.media;

import com.joshlong.mediaops.execution.ExecutionResult;
import com.joshlong.mediaops.execution.MediaContext;
import com.joshlong.mediaops.execution.PipelineExecutor;
import com.joshlong.mediaops.operations.DocumentOperation;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.operations.OperationsParser;
import com.joshlong.mediaops.storage.ObjectStore;
import com.joshlong.mediaops.utils.FileUtils;
import com.joshlong.mediaops.validation.OperationValidationException;
import com.joshlong.mediaops.validation.Pipeline;
import com.joshlong.mediaops.validation.PipelineValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import java.util.Set;

class DefaultMediaService implements MediaService {

	private static final Set<String> PAGED_FORMATS = Set.of("png", "jpg");

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final OperationsParser parser;

	private final PipelineValidator validator;

	private final PipelineExecutor executor;

	private final ObjectStore objectStore;

	private final String bucket;

	DefaultMediaService(OperationsParser parser, PipelineValidator validator, PipelineExecutor executor,
			ObjectStore objectStore, String bucket) {
		this.parser = parser;
		this.validator = validator;
		this.executor = executor;
		this.objectStore = objectStore;
		this.bucket = bucket;
	}

	@Override
	public Pipeline plan(MediaKind kind, String key, String operations) {
		Assert.hasText(key, "the key must not be empty");
		var specs = this.parser.parse(kind, operations);
		return this.validator.validate(kind, specs, FileUtils.extension(key));
	}

	@Override
	public ExecutionResult run(Pipeline pipeline, String bucket, String key) {
		var source = this.objectStore.fetch(bucket, key);
		var start = System.currentTimeMillis();
		var result = this.executor.execute(pipeline, MediaContext.of(source, FileUtils.extension(key)));
		this.log.info("ran {} stage(s) of {} over [{}/{}] in {}ms, producing {} bytes of {}", pipeline.stages().size(),
				pipeline.kind(), bucket, key, System.currentTimeMillis() - start, result.artifact().length,
				result.contentType());
		return result;
	}

	@Override
	public ExecutionResult process(MediaKind kind, String key, String operations) {
		var pipeline = this.plan(kind, key, operations);
		assertSynchronous(pipeline);
		return this.run(pipeline, this.bucket, key);
	}

	/**
	 * a caller waiting on a single response can't receive several rendered pages or
	 * choose where results are written.
	 */
	static void assertSynchronous(Pipeline pipeline) {
		if (pipeline.kind() != MediaKind.DOCUMENT)
			return;
		var name = DocumentOperation.CONVERT.operationName();
		for (var stage : pipeline.stages()) {
			var parameters = stage.parameters();
			if (parameters.given("b"))
				throw new OperationValidationException(name, "b", "only applies to asynchronous tasks");
			if (PAGED_FORMATS.contains(parameters.string("target"))
					&& (!parameters.has("pages") || parameters.pages("pages").size() != 1))
				throw new OperationValidationException(name, "pages",
						"must select exactly one page to render synchronously; submit a task to render several");
		}
	}

}

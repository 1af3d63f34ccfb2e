package com.joshlong.mediaops.documents;

import com.joshlong.mediaops.execution.MediaContext;
import com.joshlong.mediaops.execution.MediaMetadata;
import com.joshlong.mediaops.execution.MediaPart;
import com.joshlong.mediaops.execution.OperationHandler;
import com.joshlong.mediaops.execution.OperationHandlers;
import com.joshlong.mediaops.operations.DocumentOperation;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.utils.FileUtils;
import com.joshlong.mediaops.validation.StageParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * document conversion. Converting to {@code png} or {@code jpg} renders one image per
 * selected page: the first becomes the artifact and every page becomes a
 * {@link MediaPart part} called {@code page_<n>}.
 */
class DocumentOperationHandlers implements OperationHandlers<DocumentOperation> {

	static final String PAGE_PREFIX = "page_";

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final DocumentConverter converter;

	DocumentOperationHandlers(DocumentConverter converter) {
		this.converter = converter;
	}

	@Override
	public MediaKind kind() {
		return MediaKind.DOCUMENT;
	}

	@Override
	public Class<DocumentOperation> operationType() {
		return DocumentOperation.class;
	}

	@Override
	public OperationHandler handlerFor(DocumentOperation operation) {
		return switch (operation) {
			case CONVERT -> this::convert;
		};
	}

	private MediaContext convert(MediaContext context, StageParameters parameters)
			throws IOException, InterruptedException {
		var source = parameters.optionalString("source").orElse(context.format());
		if (source == null || !DocumentSchemas.SOURCE_FORMATS.contains(source))
			throw new IllegalArgumentException("documents of the format [" + source + "] can not be converted");
		var target = parameters.string("target");
		if (source.equals(target) && (target.equals("txt") || !parameters.has("pages")))
			return context.withArtifact(context.artifact(), target);
		var directory = FileUtils.createWorkingDirectory("document");
		try {
			var pdf = this.converter.toPdf(directory, context.artifact(), source);
			if (target.equals("pdf"))
				return context.withArtifact(Files.readAllBytes(pdf), target);
			var pageCount = this.converter.pageCount(pdf);
			var pages = selectPages(parameters, pageCount);
			var metadata = context.metadata().withFormat(target).with(MediaMetadata.PAGES, pageCount);
			if (target.equals("txt")) {
				var text = this.converter.toText(pdf, pages);
				return context.withArtifact(text.getBytes(StandardCharsets.UTF_8)).withMetadata(metadata);
			}
			var rendered = this.converter.toImages(pdf, pages, target);
			var contentType = target.equals("png") ? "image/png" : "image/jpeg";
			var parts = rendered.stream()
				.map(page -> new MediaPart(PAGE_PREFIX + page.number(), contentType, page.bytes()))
				.collect(Collectors.toList());
			this.log.debug("rendered pages {} of {} as {}", pages, pageCount, target);
			return new MediaContext(rendered.get(0).bytes(), metadata, parts);
		} //
		finally {
			FileUtils.delete(directory);
		}
	}

	/**
	 * the requested pages that exist, or every page if none were requested. Fails if the
	 * request names no existing page.
	 */
	static List<Integer> selectPages(StageParameters parameters, int pageCount) {
		if (!parameters.has("pages"))
			return IntStream.rangeClosed(1, pageCount).boxed().collect(Collectors.toList());
		var pages = parameters.pages("pages").stream().filter(page -> page <= pageCount).collect(Collectors.toList());
		if (pages.isEmpty())
			throw new IllegalArgumentException(
					"none of the pages " + parameters.pages("pages") + " exist in a document of " + pageCount + " pages");
		return pages;
	}

}

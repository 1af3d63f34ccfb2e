package com.joshlong.mediaops.documents;

import com.joshlong.mediaops.MediaOpsProperties;
import com.joshlong.mediaops.execution.MediaContext;
import com.joshlong.mediaops.operations.DocumentOperation;
import com.joshlong.mediaops.validation.StageParameters;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

class DocumentOperationHandlersTest {

	private final DocumentOperationHandlers handlers = new DocumentOperationHandlers(new DocumentConverter(
			new MediaOpsProperties.Media.Tools("magick", "ffmpeg", "ffprobe", "soffice", "pdftoppm", "pdftotext",
					"pdfinfo")));

	@Test
	void everyPageIsSelectedByDefault() {
		Assertions.assertEquals(List.of(1, 2, 3), DocumentOperationHandlers.selectPages(StageParameters.empty(), 3));
	}

	@Test
	void pagesPastTheEndAreDropped() {
		var parameters = StageParameters.of(Map.of("pages", List.of(2, 5, 9)));
		Assertions.assertEquals(List.of(2, 5), DocumentOperationHandlers.selectPages(parameters, 6));
		Assertions.assertThrows(IllegalArgumentException.class, () -> DocumentOperationHandlers
			.selectPages(StageParameters.of(Map.of("pages", List.of(8, 9))), 6));
	}

	@Test
	void pageCountsAreReadFromPdfinfo() {
		var info = """
				Title:          quarterly report
				Producer:       LibreOffice 7.6
				Pages:          12
				Encrypted:      no
				""";
		Assertions.assertEquals(12, DocumentConverter.pageCount(info));
		Assertions.assertThrows(IllegalStateException.class, () -> DocumentConverter.pageCount("Encrypted: no"));
	}

	@Test
	void unknownSourceFormatsAreNotConverted() {
		var context = MediaContext.of("?".getBytes(StandardCharsets.UTF_8), "xyz");
		var ex = Assertions.assertThrows(IllegalArgumentException.class, () -> this.handlers
			.handlerFor(DocumentOperation.CONVERT)
			.apply(context, StageParameters.of(Map.of("target", "pdf"))));
		Assertions.assertTrue(ex.getMessage().contains("xyz"), ex.getMessage());
	}

	@Test
	void aPdfConvertedToPdfIsPassedThrough() throws Exception {
		var bytes = "%PDF-1.7".getBytes(StandardCharsets.UTF_8);
		var result = this.handlers.handlerFor(DocumentOperation.CONVERT)
			.apply(MediaContext.of(bytes, "pdf"), StageParameters.of(Map.of("target", "pdf")));
		Assertions.assertSame(bytes, result.artifact());
		Assertions.assertEquals("pdf", result.format());
	}

}

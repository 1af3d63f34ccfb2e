package com.joshlong.mediaops.documents;

import com.joshlong.mediaops.operations.DocumentOperation;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.validation.FormatConstraintTable;
import com.joshlong.mediaops.validation.FormatConstraints;
import com.joshlong.mediaops.validation.MediaSchema;
import com.joshlong.mediaops.validation.OperationSchema;

import java.util.List;
import java.util.Set;

import static com.joshlong.mediaops.validation.Applicability.whenEquals;
import static com.joshlong.mediaops.validation.ParamSchema.of;
import static com.joshlong.mediaops.validation.ParamType.base64Text;
import static com.joshlong.mediaops.validation.ParamType.oneOf;
import static com.joshlong.mediaops.validation.ParamType.pages;

public final class DocumentSchemas {

	/**
	 * every format a document may be converted from.
	 */
	public static final Set<String> SOURCE_FORMATS = Set.of( //
			"doc", "docx", "wps", "wpss", "docm", "dotm", "dot", "dotx", "html", //
			"pptx", "ppt", "pot", "potx", "pps", "ppsx", "dps", "dpt", "pptm", "potm", "ppsm", "dpss", //
			"xls", "xlt", "et", "ett", "xlsx", "xltx", "csv", "xlsb", "xlsm", "xltm", "ets", //
			"pdf", "txt");

	public static final MediaSchema SCHEMA = MediaSchema.of(MediaKind.DOCUMENT, List.of(convert()),
			FormatConstraintTable.of(Set.of(), //
					FormatConstraints.of("pdf", "application/pdf"), //
					FormatConstraints.of("png", "image/png"), //
					FormatConstraints.of("jpg", "image/jpeg"), //
					FormatConstraints.of("txt", "text/plain; charset=utf-8")),
			new MediaSchema.OutputFormat(DocumentOperation.CONVERT, "target", "pdf"));

	private DocumentSchemas() {
	}

	private static OperationSchema convert() {
		return OperationSchema.of(DocumentOperation.CONVERT) //
			.param(of("target", oneOf("pdf", "png", "jpg", "txt")).mandatory()) //
			.param(of("source", oneOf(SOURCE_FORMATS.toArray(String[]::new)))) //
			.param(of("pages", pages()).onlyWhen(whenEquals("target", "png", "jpg", "txt"))) //
			.param(of("b", base64Text())) //
			.build();
	}

}

package com.joshlong.mediaops.image;

import com.joshlong.mediaops.operations.ImageOperation;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.validation.FormatConstraintTable;
import com.joshlong.mediaops.validation.FormatConstraints;
import com.joshlong.mediaops.validation.MediaSchema;
import com.joshlong.mediaops.validation.OperationSchema;

import java.util.List;
import java.util.Set;

import static com.joshlong.mediaops.validation.Applicability.whenEquals;
import static com.joshlong.mediaops.validation.Applicability.whenPresent;
import static com.joshlong.mediaops.validation.NumericConstraint.range;
import static com.joshlong.mediaops.validation.ParamRule.allRequiredWhen;
import static com.joshlong.mediaops.validation.ParamRule.atLeastOneOf;
import static com.joshlong.mediaops.validation.ParamSchema.of;
import static com.joshlong.mediaops.validation.ParamType.between;
import static com.joshlong.mediaops.validation.ParamType.flag;
import static com.joshlong.mediaops.validation.ParamType.hexColor;
import static com.joshlong.mediaops.validation.ParamType.oneOf;
import static com.joshlong.mediaops.validation.ParamType.percentage;
import static com.joshlong.mediaops.validation.ParamType.text;

/**
 * the parameters of every image operation and what each output format accepts.
 */
public final class ImageSchemas {

	static final int MAX_SIDE = 16_384;

	static final String[] GRAVITIES = Gravity.names();

	public static final MediaSchema SCHEMA = MediaSchema.of(MediaKind.IMAGE, List.of( //
			autoOrient(), resize(), crop(), rotate(), blur(), grayscale(), watermark(), format(), quality()), //
			formats(), //
			new MediaSchema.OutputFormat(ImageOperation.FORMAT, "f", "jpg"));

	private ImageSchemas() {
	}

	private static OperationSchema autoOrient() {
		return OperationSchema.of(ImageOperation.AUTO_ORIENT) //
			.param(of("auto", flag()).defaultsTo("0")) //
			.positional("auto") //
			.build();
	}

	private static OperationSchema resize() {
		return OperationSchema.of(ImageOperation.RESIZE) //
			.param(of("p", between(1, 1000)).exclusive("size")) //
			.param(of("w", between(1, MAX_SIDE)).exclusive("size", "wh")) //
			.param(of("h", between(1, MAX_SIDE)).exclusive("size", "wh")) //
			.param(of("l", between(1, MAX_SIDE)).exclusive("size")) //
			.param(of("s", between(1, MAX_SIDE)).exclusive("size")) //
			.param(of("m", oneOf("lfit", "mfit", "fill", "pad", "fixed")).defaultsTo("lfit")
				.onlyWhen(whenPresent("w", "h"))) //
			.param(of("limit", flag()).defaultsTo("1")) //
			.param(of("color", hexColor()).defaultsTo("FFFFFF").onlyWhen(whenEquals("m", "pad"))) //
			.rule(atLeastOneOf("p", "w", "h", "l", "s")) //
			.rule(allRequiredWhen("m", Set.of("fill", "pad", "fixed"), "w", "h")) //
			.build();
	}

	private static OperationSchema crop() {
		return OperationSchema.of(ImageOperation.CROP) //
			.param(of("w", between(1, MAX_SIDE))) //
			.param(of("h", between(1, MAX_SIDE))) //
			.param(of("x", between(0, MAX_SIDE)).defaultsTo("0")) //
			.param(of("y", between(0, MAX_SIDE)).defaultsTo("0")) //
			.param(of("g", oneOf(GRAVITIES)).defaultsTo("nw")) //
			.rule(atLeastOneOf("w", "h")) //
			.build();
	}

	private static OperationSchema rotate() {
		return OperationSchema.of(ImageOperation.ROTATE) //
			.param(of("degree", oneOf(90, 180, 270)).defaultsTo("90")) //
			.positional("degree") //
			.build();
	}

	private static OperationSchema blur() {
		return OperationSchema.of(ImageOperation.BLUR) //
			.param(of("radius", between(1, 50)).defaultsTo("2")) //
			.positional("radius") //
			.build();
	}

	private static OperationSchema grayscale() {
		return OperationSchema.of(ImageOperation.GRAYSCALE).build();
	}

	private static OperationSchema watermark() {
		return OperationSchema.of(ImageOperation.WATERMARK) //
			.param(of("text", text(64)).defaultsTo("Watermark")) //
			.param(of("color", hexColor()).defaultsTo("000000")) //
			.param(of("t", between(0, 100)).defaultsTo("100")) //
			.param(of("g", oneOf(GRAVITIES)).defaultsTo("se")) //
			.param(of("x", between(0, 4096)).defaultsTo("10")) //
			.param(of("y", between(0, 4096)).defaultsTo("10")) //
			.param(of("voffset", between(-1000, 1000)).defaultsTo("0")) //
			.param(of("fill", flag()).defaultsTo("0")) //
			.param(of("padx", between(0, 4096)).defaultsTo("0")) //
			.param(of("pady", between(0, 4096)).defaultsTo("0")) //
			.param(of("size", between(1, 1000)).defaultsTo("40")) //
			.param(of("shadow", between(0, 100)).defaultsTo("0")) //
			.param(of("rotate", between(0, 360)).defaultsTo("0")) //
			.build();
	}

	private static OperationSchema format() {
		return OperationSchema.of(ImageOperation.FORMAT) //
			.param(of("f", oneOf("jpg", "jpeg", "png", "webp", "bmp", "gif", "tiff")).mandatory()) //
			.param(of("q", percentage())) //
			.positional("f") //
			.build();
	}

	private static OperationSchema quality() {
		return OperationSchema.of(ImageOperation.QUALITY) //
			.param(of("q", percentage()).exclusive("quality")) //
			.param(of("Q", percentage()).exclusive("quality")) //
			.rule(atLeastOneOf("q", "Q")) //
			.build();
	}

	private static FormatConstraintTable formats() {
		return FormatConstraintTable.of(Set.of("q", "Q"), //
				lossy("jpg", "image/jpeg"), //
				lossy("jpeg", "image/jpeg"), //
				lossy("webp", "image/webp"), //
				FormatConstraints.of("png", "image/png"), //
				FormatConstraints.of("bmp", "image/bmp"), //
				FormatConstraints.of("gif", "image/gif"), //
				FormatConstraints.of("tiff", "image/tiff"));
	}

	private static FormatConstraints lossy(String format, String contentType) {
		return FormatConstraints.of(format, contentType) //
			.allow("q", range(1, 100)) //
			.allow("Q", range(1, 100)) //
			.defaultTo("q", 85);
	}

}

package com.joshlong.mediaops.image;

import com.joshlong.mediaops.execution.MediaContext;
import com.joshlong.mediaops.execution.MediaMetadata;
import com.joshlong.mediaops.execution.OperationHandler;
import com.joshlong.mediaops.execution.OperationHandlers;
import com.joshlong.mediaops.operations.ImageOperation;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.validation.StageParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.function.BiFunction;

/**
 * image operations. Each stage decodes the current artifact, transforms it and encodes it
 * again in the current format, so the context always holds a real image in the format its
 * metadata names.
 * <p>
 * The metadata carries {@code quality}: the compression quality of the last lossy
 * encoding, or 100 if there hasn't been one. A relative {@code quality,q_N} is a
 * percentage of it.
 */
class ImageOperationHandlers implements OperationHandlers<ImageOperation> {

	static final String QUALITY = "quality";

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final ImageCodec codec;

	private final Magick magick;

	ImageOperationHandlers(ImageCodec codec, Magick magick) {
		this.codec = codec;
		this.magick = magick;
	}

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
		return switch (operation) {
			case AUTO_ORIENT -> this::autoOrient;
			case RESIZE -> this.transforming(ImageTransforms::resize);
			case CROP -> this.transforming(ImageTransforms::crop);
			case ROTATE -> this.transforming((image, p) -> ImageTransforms.rotate(image, p.integer("degree")));
			case BLUR -> this.transforming((image, p) -> ImageTransforms.blur(image, p.integer("radius")));
			case GRAYSCALE -> this.transforming((image, p) -> ImageTransforms.grayscale(image));
			case WATERMARK -> this.transforming(ImageTransforms::watermark);
			case FORMAT -> this::format;
			case QUALITY -> this::quality;
		};
	}

	private OperationHandler transforming(BiFunction<BufferedImage, StageParameters, BufferedImage> transform) {
		return (context, parameters) -> {
			var image = this.codec.decode(context.artifact(), context.format());
			var transformed = transform.apply(image, parameters);
			var quality = context.metadata().attribute(QUALITY).map(Integer.class::cast).orElse(null);
			var format = outputFormat(context);
			var bytes = this.codec.encode(transformed, format, quality);
			return context.withArtifact(bytes).withMetadata(describe(context.metadata().withFormat(format), transformed));
		};
	}

	private MediaContext autoOrient(MediaContext context, StageParameters parameters)
			throws IOException, InterruptedException {
		if (!parameters.flag("auto"))
			return context;
		var format = outputFormat(context);
		var oriented = this.magick.convert(context.artifact(), ImageCodec.normalize(context.format()), format,
				"-auto-orient");
		var image = this.codec.decode(oriented, format);
		return context.withArtifact(oriented).withMetadata(describe(context.metadata().withFormat(format), image));
	}

	private MediaContext format(MediaContext context, StageParameters parameters)
			throws IOException, InterruptedException {
		var format = ImageCodec.normalize(parameters.string("f"));
		var quality = parameters.optionalInteger("q").orElse(null);
		var image = this.codec.decode(context.artifact(), context.format());
		var bytes = this.codec.encode(image, format, quality);
		this.log.debug("re-encoded {} as {} at quality {}", context.format(), format, quality);
		var metadata = describe(context.metadata().withFormat(format), image);
		return context.withArtifact(bytes).withMetadata(quality == null ? metadata : metadata.with(QUALITY, quality));
	}

	private MediaContext quality(MediaContext context, StageParameters parameters)
			throws IOException, InterruptedException {
		var current = context.metadata().attribute(QUALITY).map(Integer.class::cast).orElse(100);
		var quality = parameters.optionalInteger("Q")
			.orElseGet(() -> Math.max(1, Math.round(current * parameters.integer("q") / 100f)));
		var image = this.codec.decode(context.artifact(), context.format());
		var format = outputFormat(context);
		var bytes = this.codec.encode(image, format, quality);
		return context.withArtifact(bytes)
			.withMetadata(describe(context.metadata().withFormat(format), image).with(QUALITY, quality));
	}

	/**
	 * the format a stage re-encodes into when it doesn't name one: the artifact's own, if
	 * it can be written, and otherwise the one the pipeline has to produce.
	 */
	private static String outputFormat(MediaContext context) {
		var current = ImageCodec.normalize(context.format());
		if (ImageCodec.writable(current))
			return current;
		return context.metadata()
			.attribute(MediaMetadata.OUTPUT_FORMAT)
			.map(f -> ImageCodec.normalize(String.valueOf(f)))
			.orElse(current);
	}

	private static MediaMetadata describe(MediaMetadata metadata, BufferedImage image) {
		return metadata.with(MediaMetadata.WIDTH, image.getWidth()).with(MediaMetadata.HEIGHT, image.getHeight());
	}

}

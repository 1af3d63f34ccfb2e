package com.joshlong.mediaops.image;

import com.joshlong.mediaops.audio.AudioSchemas;
import com.joshlong.mediaops.documents.DocumentSchemas;
import com.joshlong.mediaops.execution.ExecutionResult;
import com.joshlong.mediaops.execution.MediaContext;
import com.joshlong.mediaops.execution.MediaMetadata;
import com.joshlong.mediaops.execution.PipelineExecutionException;
import com.joshlong.mediaops.execution.PipelineExecutor;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.operations.OperationsParser;
import com.joshlong.mediaops.validation.PipelineValidator;
import com.joshlong.mediaops.validation.SchemaRegistry;
import com.joshlong.mediaops.video.VideoSchemas;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * runs image pipelines end to end over png sources, which never need ImageMagick.
 */
class ImageOperationHandlersTest {

	private final OperationsParser parser = new OperationsParser();

	private final PipelineValidator validator = new PipelineValidator(new SchemaRegistry(
			List.of(ImageSchemas.SCHEMA, AudioSchemas.SCHEMA, VideoSchemas.SCHEMA, DocumentSchemas.SCHEMA)));

	private final PipelineExecutor executor;

	ImageOperationHandlersTest() {
		var magick = new Magick("magick");
		this.executor = new PipelineExecutor(List.of(new ImageOperationHandlers(new ImageCodec(magick), magick)));
	}

	private static byte[] png(int width, int height) throws IOException {
		var image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		var graphics = image.createGraphics();
		try {
			graphics.setColor(Color.ORANGE);
			graphics.fillRect(0, 0, width, height);
			graphics.setColor(Color.BLACK);
			graphics.fillRect(width / 4, height / 4, width / 2, height / 2);
		} //
		finally {
			graphics.dispose();
		}
		var out = new ByteArrayOutputStream();
		ImageIO.write(image, "png", out);
		return out.toByteArray();
	}

	private ExecutionResult run(String operations, byte[] source) {
		return this.run(operations, source, "png");
	}

	private ExecutionResult run(String operations, byte[] source, String sourceFormat) {
		var pipeline = this.validator.validate(MediaKind.IMAGE, this.parser.parse(MediaKind.IMAGE, operations),
				sourceFormat);
		return this.executor.execute(pipeline, MediaContext.of(source, sourceFormat));
	}

	private static byte[] tiff(int width, int height) throws IOException {
		var image = read(png(width, height));
		var out = new ByteArrayOutputStream();
		Assertions.assertTrue(ImageIO.write(image, "tiff", out));
		return out.toByteArray();
	}

	private static String formatOf(byte[] bytes) throws IOException {
		try (var in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
			var readers = ImageIO.getImageReaders(in);
			Assertions.assertTrue(readers.hasNext());
			return ImageCodec.normalize(readers.next().getFormatName());
		}
	}

	private static BufferedImage read(byte[] bytes) throws IOException {
		return ImageIO.read(new ByteArrayInputStream(bytes));
	}

	@Test
	void resizingByWidthScalesTheHeight() throws Exception {
		var result = this.run("resize,w_800", png(1600, 1200));
		var image = read(result.artifact());
		Assertions.assertEquals(800, image.getWidth());
		Assertions.assertEquals(600, image.getHeight());
		Assertions.assertEquals(800, result.metadata().attribute(MediaMetadata.WIDTH).orElseThrow());
		Assertions.assertEquals(600, result.metadata().attribute(MediaMetadata.HEIGHT).orElseThrow());
		Assertions.assertEquals("image/png", result.contentType());
	}

	@Test
	void theOrderOfStagesMatters() throws Exception {
		var source = png(1600, 1200);
		var resizeThenCrop = read(this.run("resize,w_800/crop,w_1000", source).artifact());
		var cropThenResize = read(this.run("crop,w_1000/resize,w_800", source).artifact());
		Assertions.assertEquals(800, resizeThenCrop.getWidth());
		Assertions.assertEquals(600, resizeThenCrop.getHeight());
		Assertions.assertEquals(800, cropThenResize.getWidth());
		Assertions.assertEquals(960, cropThenResize.getHeight());
	}

	@Test
	void formatChangesTheEncoding() throws Exception {
		var result = this.run("rotate,90/format,jpg,q_70", png(40, 20));
		Assertions.assertEquals("jpg", result.metadata().format());
		Assertions.assertEquals("image/jpeg", result.contentType());
		Assertions.assertEquals(70, result.metadata().attribute(ImageOperationHandlers.QUALITY).orElseThrow());
		var image = read(result.artifact());
		Assertions.assertEquals(20, image.getWidth());
		Assertions.assertEquals(40, image.getHeight());
	}

	@Test
	void relativeQualityIsAShareOfTheCurrentQuality() throws Exception {
		var result = this.run("format,jpg,q_80/quality,q_50", png(30, 30));
		Assertions.assertEquals(40, result.metadata().attribute(ImageOperationHandlers.QUALITY).orElseThrow());
	}

	@Test
	void aCorruptSourceFailsTheFirstStage() {
		var ex = Assertions.assertThrows(PipelineExecutionException.class,
				() -> this.run("grayscale/resize,w_10", "not an image".getBytes(StandardCharsets.UTF_8)));
		Assertions.assertEquals(0, ex.position());
		Assertions.assertEquals("grayscale", ex.operation());
	}

	@Test
	void aTifSourceStaysTiff() throws Exception {
		var result = this.run("resize,w_20", tiff(40, 20), "tif");
		Assertions.assertEquals("tiff", result.metadata().format());
		Assertions.assertEquals("image/tiff", result.contentType());
		Assertions.assertEquals("tiff", formatOf(result.artifact()));
		Assertions.assertEquals(20, read(result.artifact()).getWidth());
	}

	@Test
	void aSourceInAFormatThatCantBeWrittenIsEncodedAsTheDefaultFormat() throws Exception {
		var result = this.run("resize,w_20", png(40, 20), "heic");
		Assertions.assertEquals("jpg", result.metadata().format());
		Assertions.assertEquals("image/jpeg", result.contentType());
		Assertions.assertEquals("jpg", formatOf(result.artifact()));
		Assertions.assertEquals(10, read(result.artifact()).getHeight());
	}

}

package com.joshlong.mediaops.image;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * turns bytes into a {@link BufferedImage} and back. ImageIO handles jpg, png, bmp, gif
 * and tiff; anything else goes through {@link Magick}.
 */
class ImageCodec {

	static final String INTERMEDIATE_FORMAT = "png";

	private static final Set<String> OPAQUE_FORMATS = Set.of("jpg", "jpeg", "bmp");

	private static final Set<String> WRITABLE_FORMATS = Set.of("jpg", "png", "webp", "bmp", "gif", "tiff");

	private final Magick magick;

	ImageCodec(Magick magick) {
		this.magick = magick;
	}

	BufferedImage decode(byte[] bytes, String format) throws IOException, InterruptedException {
		var image = ImageIO.read(new ByteArrayInputStream(bytes));
		if (image != null)
			return image;
		var png = this.magick.convert(bytes, format == null ? "img" : format, INTERMEDIATE_FORMAT);
		image = ImageIO.read(new ByteArrayInputStream(png));
		if (image == null)
			throw new IOException("the artifact is not an image in a known format");
		return image;
	}

	/**
	 * @param quality the compression quality, 1 to 100, for lossy formats, or
	 * {@code null} for the writer's default
	 */
	byte[] encode(BufferedImage image, String format, Integer quality) throws IOException, InterruptedException {
		var normalized = normalize(format);
		if (normalized.equals("webp")) {
			var png = this.write(image, INTERMEDIATE_FORMAT, null);
			return quality == null ? this.magick.convert(png, INTERMEDIATE_FORMAT, "webp")
					: this.magick.convert(png, INTERMEDIATE_FORMAT, "webp", "-quality", String.valueOf(quality));
		}
		var writable = OPAQUE_FORMATS.contains(normalized) ? flatten(image) : image;
		return this.write(writable, normalized, quality);
	}

	private byte[] write(BufferedImage image, String format, Integer quality) throws IOException {
		var writers = ImageIO.getImageWritersByFormatName(format);
		if (!writers.hasNext())
			throw new IOException("there is no writer for the format [" + format + "]");
		var writer = writers.next();
		var out = new ByteArrayOutputStream();
		try (var ios = ImageIO.createImageOutputStream(out)) {
			writer.setOutput(ios);
			var param = writer.getDefaultWriteParam();
			if (quality != null && param.canWriteCompressed()) {
				param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
				if (param.getCompressionType() == null && param.getCompressionTypes().length > 0)
					param.setCompressionType(param.getCompressionTypes()[0]);
				param.setCompressionQuality(quality / 100f);
			}
			writer.write(null, new IIOImage(image, null, null), param);
		} //
		finally {
			writer.dispose();
		}
		return out.toByteArray();
	}

	static String normalize(String format) {
		var lower = format == null ? "jpg" : format.toLowerCase(Locale.ROOT);
		return switch (lower) {
			case "jpeg" -> "jpg";
			case "tif" -> "tiff";
			default -> lower;
		};
	}

	static boolean writable(String format) {
		return format != null && WRITABLE_FORMATS.contains(normalize(format));
	}

	/**
	 * draws the image onto white, dropping the alpha channel formats like jpg can't hold.
	 */
	static BufferedImage flatten(BufferedImage image) {
		if (image.getType() == BufferedImage.TYPE_INT_RGB || image.getType() == BufferedImage.TYPE_3BYTE_BGR)
			return image;
		var rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
		var graphics = rgb.createGraphics();
		try {
			graphics.setColor(Color.WHITE);
			graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
			graphics.drawImage(image, 0, 0, null);
		} //
		finally {
			graphics.dispose();
		}
		return rgb;
	}

}

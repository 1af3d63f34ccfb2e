package com.joshlong.mediaops.image;

import com.joshlong.mediaops.validation.StageParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;

/**
 * the pixel work behind the image operations, done with Java2D.
 */
abstract class ImageTransforms {

	private static final Logger log = LoggerFactory.getLogger(ImageTransforms.class);

	/**
	 * the size {@code resize} produces for an image of the given size, or the original size
	 * when {@code limit} forbids enlarging it. For {@code fill} and {@code pad} this is the
	 * size of the scaled image before it is cropped or padded to {@code w x h}.
	 */
	static Dimension resizeTarget(int width, int height, StageParameters parameters) {
		double ratio;
		if (parameters.has("p")) {
			ratio = parameters.integer("p") / 100d;
		}
		else if (parameters.has("l")) {
			ratio = (double) parameters.integer("l") / Math.max(width, height);
		}
		else if (parameters.has("s")) {
			ratio = (double) parameters.integer("s") / Math.min(width, height);
		}
		else {
			var w = parameters.optionalInteger("w");
			var h = parameters.optionalInteger("h");
			var mode = parameters.string("m");
			if (mode.equals("fixed"))
				return new Dimension(w.orElseThrow(), h.orElseThrow());
			var wr = w.map(v -> (double) v / width);
			var hr = h.map(v -> (double) v / height);
			if (wr.isPresent() && hr.isPresent()) {
				var cover = mode.equals("mfit") || mode.equals("fill");
				ratio = cover ? Math.max(wr.get(), hr.get()) : Math.min(wr.get(), hr.get());
			}
			else {
				ratio = wr.orElseGet(hr::orElseThrow);
			}
		}
		return new Dimension(Math.max(1, (int) (width * ratio)), Math.max(1, (int) (height * ratio)));
	}

	static BufferedImage resize(BufferedImage image, StageParameters parameters) {
		var width = image.getWidth();
		var height = image.getHeight();
		var target = resizeTarget(width, height, parameters);
		if (parameters.flag("limit") && (target.width > width || target.height > height)) {
			log.debug("not enlarging {}x{} to {}x{}", width, height, target.width, target.height);
			return image;
		}
		var scaled = scale(image, target.width, target.height);
		var mode = parameters.optionalString("m").orElse("lfit");
		if (mode.equals("fill")) {
			var w = parameters.integer("w");
			var h = parameters.integer("h");
			return copy(scaled.getSubimage(Math.max(0, (scaled.getWidth() - w) / 2),
					Math.max(0, (scaled.getHeight() - h) / 2), Math.min(w, scaled.getWidth()),
					Math.min(h, scaled.getHeight())));
		}
		if (mode.equals("pad")) {
			var w = parameters.integer("w");
			var h = parameters.integer("h");
			var padded = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
			var graphics = padded.createGraphics();
			try {
				graphics.setColor(color(parameters.string("color"), 100));
				graphics.fillRect(0, 0, w, h);
				graphics.drawImage(scaled, (w - scaled.getWidth()) / 2, (h - scaled.getHeight()) / 2, null);
			} //
			finally {
				graphics.dispose();
			}
			return padded;
		}
		return scaled;
	}

	static BufferedImage crop(BufferedImage image, StageParameters parameters) {
		var width = image.getWidth();
		var height = image.getHeight();
		var boxWidth = Math.min(parameters.optionalInteger("w").orElse(width), width);
		var boxHeight = Math.min(parameters.optionalInteger("h").orElse(height), height);
		var origin = Gravity.of(parameters.string("g"))
			.place(width, height, boxWidth, boxHeight, parameters.integer("x"), parameters.integer("y"));
		var x0 = Math.max(0, origin.x);
		var y0 = Math.max(0, origin.y);
		var x1 = Math.min(width, origin.x + boxWidth);
		var y1 = Math.min(height, origin.y + boxHeight);
		if (x1 <= x0 || y1 <= y0)
			throw new IllegalArgumentException(
					"the crop area lies outside the " + width + "x" + height + " image");
		return copy(image.getSubimage(x0, y0, x1 - x0, y1 - y0));
	}

	/**
	 * rotates clockwise by a multiple of 90 degrees.
	 */
	static BufferedImage rotate(BufferedImage image, int degrees) {
		var quarterTurns = (degrees / 90) % 4;
		var swap = quarterTurns % 2 == 1;
		var width = image.getWidth();
		var height = image.getHeight();
		var rotated = new BufferedImage(swap ? height : width, swap ? width : height, BufferedImage.TYPE_INT_ARGB);
		var transform = new AffineTransform();
		transform.translate(rotated.getWidth() / 2d, rotated.getHeight() / 2d);
		transform.quadrantRotate(quarterTurns);
		transform.translate(-width / 2d, -height / 2d);
		var graphics = rotated.createGraphics();
		try {
			graphics.drawImage(image, transform, null);
		} //
		finally {
			graphics.dispose();
		}
		return rotated;
	}

	/**
	 * a gaussian blur, applied as one horizontal and one vertical pass.
	 */
	static BufferedImage blur(BufferedImage image, int radius) {
		var sigma = Math.max(radius / 2d, 0.5d);
		var size = radius * 2 + 1;
		var weights = new float[size];
		var sum = 0f;
		for (var i = 0; i < size; i++) {
			var d = i - radius;
			weights[i] = (float) Math.exp(-(d * d) / (2 * sigma * sigma));
			sum += weights[i];
		}
		for (var i = 0; i < size; i++)
			weights[i] /= sum;
		var source = copy(image);
		var horizontal = new ConvolveOp(new Kernel(size, 1, weights), ConvolveOp.EDGE_NO_OP, null);
		var vertical = new ConvolveOp(new Kernel(1, size, weights), ConvolveOp.EDGE_NO_OP, null);
		return vertical.filter(horizontal.filter(source, null), null);
	}

	/**
	 * keeps each pixel's alpha and replaces its color with its luminance.
	 */
	static BufferedImage grayscale(BufferedImage image) {
		var gray = copy(image);
		for (var y = 0; y < gray.getHeight(); y++) {
			for (var x = 0; x < gray.getWidth(); x++) {
				var argb = gray.getRGB(x, y);
				var r = (argb >> 16) & 0xff;
				var g = (argb >> 8) & 0xff;
				var b = argb & 0xff;
				var luma = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
				gray.setRGB(x, y, (argb & 0xff000000) | (luma << 16) | (luma << 8) | luma);
			}
		}
		return gray;
	}

	static BufferedImage watermark(BufferedImage image, StageParameters parameters) {
		var marked = copy(image);
		var graphics = marked.createGraphics();
		try {
			graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
			graphics.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, parameters.integer("size")));
			var text = parameters.string("text");
			var metrics = graphics.getFontMetrics();
			var textWidth = metrics.stringWidth(text);
			var textHeight = metrics.getAscent() + metrics.getDescent();
			var shadow = parameters.integer("shadow");
			var color = color(parameters.string("color"), parameters.integer("t"));
			var rotation = Math.toRadians(parameters.integer("rotate"));
			if (parameters.flag("fill")) {
				var stepX = textWidth + Math.max(parameters.integer("padx"), 1);
				var stepY = textHeight + Math.max(parameters.integer("pady"), 1);
				for (var y = 0; y < marked.getHeight() + stepY; y += stepY)
					for (var x = 0; x < marked.getWidth() + stepX; x += stepX)
						drawText(graphics, text, x, y + metrics.getAscent(), rotation, color, shadow);
			}
			else {
				var gravity = Gravity.of(parameters.string("g"));
				var origin = gravity.place(marked.getWidth(), marked.getHeight(), textWidth, textHeight,
						parameters.integer("x"), parameters.integer("y"));
				var voffset = gravity.verticallyCentered() ? parameters.integer("voffset") : 0;
				drawText(graphics, text, origin.x, origin.y + metrics.getAscent() - voffset, rotation, color, shadow);
			}
		} //
		finally {
			graphics.dispose();
		}
		return marked;
	}

	private static void drawText(Graphics2D graphics, String text, int x, int y, double rotation,
			Color color, int shadow) {
		var saved = graphics.getTransform();
		try {
			if (rotation != 0)
				graphics.rotate(rotation, x, y);
			if (shadow > 0) {
				graphics.setComposite(AlphaComposite.SrcOver);
				graphics.setColor(new Color(0, 0, 0, Math.round(shadow * 2.55f)));
				graphics.drawString(text, x + 2, y + 2);
			}
			graphics.setColor(color);
			graphics.drawString(text, x, y);
		} //
		finally {
			graphics.setTransform(saved);
		}
	}

	/**
	 * @param opacity 0 (invisible) to 100 (opaque)
	 */
	static Color color(String hex, int opacity) {
		var rgb = Integer.parseInt(hex, 16);
		return new Color((rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff, Math.round(opacity * 2.55f));
	}

	static BufferedImage scale(BufferedImage image, int width, int height) {
		var scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
		var graphics = scaled.createGraphics();
		try {
			graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
			graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
			graphics.drawImage(image, 0, 0, width, height, null);
		} //
		finally {
			graphics.dispose();
		}
		return scaled;
	}

	/**
	 * an ARGB copy that shares no raster with the original.
	 */
	static BufferedImage copy(BufferedImage image) {
		var copy = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
		var graphics = copy.createGraphics();
		try {
			graphics.drawImage(image, 0, 0, null);
		} //
		finally {
			graphics.dispose();
		}
		return copy;
	}

}

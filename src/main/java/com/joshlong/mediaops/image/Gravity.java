package com.joshlong.mediaops.image;

import java.awt.Point;
import java.util.Arrays;
import java.util.Locale;

/**
 * the nine anchors a box can be placed against inside a larger area. Offsets push the box
 * away from the anchored edges, towards the middle.
 */
enum Gravity {

	NW(-1, -1), NORTH(0, -1), NE(1, -1), WEST(-1, 0), CENTER(0, 0), EAST(1, 0), SW(-1, 1), SOUTH(0, 1), SE(1, 1);

	private final int horizontal;

	private final int vertical;

	Gravity(int horizontal, int vertical) {
		this.horizontal = horizontal;
		this.vertical = vertical;
	}

	static Gravity of(String name) {
		return valueOf(name.toUpperCase(Locale.ROOT));
	}

	static String[] names() {
		return Arrays.stream(values()).map(g -> g.name().toLowerCase(Locale.ROOT)).toArray(String[]::new);
	}

	/**
	 * @return the top-left corner of a {@code boxWidth x boxHeight} box anchored to this
	 * gravity inside a {@code width x height} area
	 */
	Point place(int width, int height, int boxWidth, int boxHeight, int dx, int dy) {
		return new Point(coordinate(this.horizontal, width, boxWidth, dx),
				coordinate(this.vertical, height, boxHeight, dy));
	}

	boolean verticallyCentered() {
		return this.vertical == 0;
	}

	private static int coordinate(int anchor, int extent, int box, int offset) {
		return switch (anchor) {
			case -1 -> offset;
			case 1 -> extent - box - offset;
			default -> (extent - box) / 2 + offset;
		};
	}

}

package com.joshlong.mediaops.video;

import com.joshlong.mediaops.validation.StageParameters;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.awt.Dimension;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

class SnapshotCommandTest {

	private static StageParameters snapshot(Map<String, Object> values) {
		var copy = new HashMap<>(values);
		copy.putIfAbsent("t", 0);
		copy.putIfAbsent("w", 0);
		copy.putIfAbsent("h", 0);
		copy.putIfAbsent("m", "default");
		copy.putIfAbsent("f", "jpg");
		copy.putIfAbsent("ar", "auto");
		return StageParameters.of(copy);
	}

	@Test
	void aMissingSideFollowsTheAspectRatio() {
		Assertions.assertEquals(new Dimension(1920, 1080), SnapshotCommand.dimensions(1920, 1080, 0, 0));
		Assertions.assertEquals(new Dimension(640, 360), SnapshotCommand.dimensions(1920, 1080, 640, 0));
		Assertions.assertEquals(new Dimension(960, 540), SnapshotCommand.dimensions(1920, 1080, 0, 540));
		Assertions.assertEquals(new Dimension(100, 100), SnapshotCommand.dimensions(1920, 1080, 100, 100));
	}

	@Test
	void filters() {
		var landscape = new Dimension(640, 360);
		Assertions.assertEquals(List.of("scale=640:360"), SnapshotCommand.filters(landscape, snapshot(Map.of())));
		Assertions.assertEquals(List.of("select=eq(pict_type\\,I)", "scale=640:360", "transpose=1"),
				SnapshotCommand.filters(landscape, snapshot(Map.of("m", "fast", "ar", "h"))));
		Assertions.assertEquals(List.of("scale=360:640", "transpose=2"),
				SnapshotCommand.filters(new Dimension(360, 640), snapshot(Map.of("ar", "w"))));
		Assertions.assertEquals(List.of("scale=640:360"),
				SnapshotCommand.filters(landscape, snapshot(Map.of("ar", "w"))));
	}

	@Test
	void commands() {
		var jpg = SnapshotCommand.build("ffmpeg", "in.mp4", "out.jpg", new Dimension(640, 360),
				snapshot(Map.of("t", 1500)));
		Assertions.assertEquals("1.500", jpg.get(jpg.indexOf("-ss") + 1));
		Assertions.assertTrue(jpg.indexOf("-ss") < jpg.indexOf("-i"));
		Assertions.assertTrue(jpg.contains("-qscale:v"));
		Assertions.assertEquals(List.of("-frames:v", "1", "out.jpg"), jpg.subList(jpg.size() - 3, jpg.size()));
		var png = SnapshotCommand.build("ffmpeg", "in.mp4", "out.png", new Dimension(640, 360),
				snapshot(Map.of("f", "png")));
		Assertions.assertTrue(png.contains("-compression_level"));
		Assertions.assertFalse(png.contains("-qscale:v"));
	}

}

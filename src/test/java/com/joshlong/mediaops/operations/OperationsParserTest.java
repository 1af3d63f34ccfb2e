package com.joshlong.mediaops.operations;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class OperationsParserTest {

	private final OperationsParser parser = new OperationsParser();

	@Test
	void stagesKeepTheOrderTheyWereWrittenIn() {
		var specs = this.parser.parse(MediaKind.IMAGE, "resize,w_800/crop,w_200,h_200,g_center/rotate,90");
		Assertions.assertEquals(3, specs.size());
		Assertions.assertEquals(List.of(ImageOperation.RESIZE, ImageOperation.CROP, ImageOperation.ROTATE),
				specs.stream().map(OperationSpec::operation).toList());
		Assertions.assertEquals(List.of(0, 1, 2), specs.stream().map(OperationSpec::position).toList());
		Assertions.assertEquals(List.of("w", "h", "g"), List.copyOf(specs.get(1).params().keySet()));
		Assertions.assertEquals("center", specs.get(1).params().get("g"));
	}

	@Test
	void parsingIsDeterministic() {
		var operations = "convert,f_mp3,ar_44100,ac_2";
		Assertions.assertEquals(this.parser.parse(MediaKind.AUDIO, operations),
				this.parser.parse(MediaKind.AUDIO, operations));
	}

	@Test
	void valuesAreSplitOnTheFirstUnderscore() {
		var spec = this.parser.parse(MediaKind.IMAGE, "watermark,text_hello_world").get(0);
		Assertions.assertEquals("hello_world", spec.params().get("text"));
	}

	@Test
	void whitespaceAroundTokensIsIgnored() {
		var spec = this.parser.parse(MediaKind.IMAGE, " resize, w_800 ,h_600").get(0);
		Assertions.assertEquals(ImageOperation.RESIZE, spec.operation());
		Assertions.assertEquals("800", spec.params().get("w"));
		Assertions.assertEquals("600", spec.params().get("h"));
	}

	@Test
	void bareTokensHaveEmptyValues() {
		var spec = this.parser.parse(MediaKind.IMAGE, "rotate,90").get(0);
		Assertions.assertTrue(spec.isBare("90"));
		Assertions.assertFalse(spec.isBare("degree"));
	}

	@Test
	void emptyOperationsMeanAnEmptyPipeline() {
		Assertions.assertTrue(this.parser.parse(MediaKind.IMAGE, null).isEmpty());
		Assertions.assertTrue(this.parser.parse(MediaKind.IMAGE, "  ").isEmpty());
	}

	@Test
	void emptyStagesAreRejected() {
		var ex = Assertions.assertThrows(OperationParseException.class,
				() -> this.parser.parse(MediaKind.IMAGE, "resize,w_800//rotate,90"));
		Assertions.assertEquals(1, ex.position());
	}

	@Test
	void operationsOfAnotherMediaKindAreRejected() {
		Assertions.assertThrows(OperationParseException.class,
				() -> this.parser.parse(MediaKind.AUDIO, "resize,w_800"));
		Assertions.assertThrows(OperationParseException.class, () -> this.parser.parse(MediaKind.IMAGE, "sharpen"));
	}

	@Test
	void tokensWithoutKeysAreRejected() {
		var ex = Assertions.assertThrows(OperationParseException.class,
				() -> this.parser.parse(MediaKind.IMAGE, "rotate,90/resize,_800"));
		Assertions.assertEquals(1, ex.position());
		Assertions.assertThrows(OperationParseException.class, () -> this.parser.parse(MediaKind.IMAGE, "resize,"));
	}

	@Test
	void repeatedKeysAreRejected() {
		var ex = Assertions.assertThrows(OperationParseException.class,
				() -> this.parser.parse(MediaKind.IMAGE, "resize,w_800,w_400"));
		Assertions.assertTrue(ex.getMessage().contains("[w]"), ex.getMessage());
	}

	@Test
	void theSameKeyMayAppearInDifferentStages() {
		var specs = this.parser.parse(MediaKind.IMAGE, "resize,w_800/resize,w_400");
		Assertions.assertEquals("800", specs.get(0).params().get("w"));
		Assertions.assertEquals("400", specs.get(1).params().get("w"));
	}

}

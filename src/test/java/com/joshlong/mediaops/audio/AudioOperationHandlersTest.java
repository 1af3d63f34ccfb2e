package com.joshlong.mediaops.audio;

import com.joshlong.mediaops.execution.MediaContext;
import com.joshlong.mediaops.operations.AudioOperation;
import com.joshlong.mediaops.validation.StageParameters;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

class AudioOperationHandlersTest {

	@Test
	void wavSourcesAreRecognizedByTheirHeader() {
		Assertions.assertTrue(AudioOperationHandlers.isWav("RIFF\0\0\0\0WAVEfmt ".getBytes(StandardCharsets.US_ASCII)));
		Assertions.assertFalse(AudioOperationHandlers.isWav("ID3\3\0\0\0\0\0\0\0\0".getBytes(StandardCharsets.US_ASCII)));
		Assertions.assertFalse(AudioOperationHandlers.isWav(new byte[4]));
	}

	@Test
	void onlyWavSourcesAreConverted() {
		var handlers = new AudioOperationHandlers("ffmpeg");
		var context = MediaContext.of("ID3\3\0\0\0\0\0\0\0\0".getBytes(StandardCharsets.US_ASCII), "mp3");
		var ex = Assertions.assertThrows(IllegalArgumentException.class, () -> handlers
			.handlerFor(AudioOperation.CONVERT)
			.apply(context, StageParameters.of(Map.of("f", "flac"))));
		Assertions.assertTrue(ex.getMessage().contains("WAV"), ex.getMessage());
	}

}

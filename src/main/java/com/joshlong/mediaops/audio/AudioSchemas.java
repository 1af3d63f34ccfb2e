package com.joshlong.mediaops.audio;

import com.joshlong.mediaops.operations.AudioOperation;
import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.validation.FormatConstraintTable;
import com.joshlong.mediaops.validation.FormatConstraints;
import com.joshlong.mediaops.validation.MediaSchema;
import com.joshlong.mediaops.validation.OperationSchema;
import com.joshlong.mediaops.validation.ParamType;

import java.util.List;
import java.util.Set;

import static com.joshlong.mediaops.validation.Applicability.whenEquals;
import static com.joshlong.mediaops.validation.Applicability.whenPresent;
import static com.joshlong.mediaops.validation.NumericConstraint.oneOf;
import static com.joshlong.mediaops.validation.NumericConstraint.range;
import static com.joshlong.mediaops.validation.ParamSchema.of;
import static com.joshlong.mediaops.validation.ParamType.between;

/**
 * the parameters of {@code convert} and the sample rates, channel counts and bitrates each
 * output format supports.
 */
public final class AudioSchemas {

	static final int[] SAMPLE_RATES = { 8000, 11025, 12000, 16000, 22050, 24000, 32000, 44100, 48000, 64000, 88200,
			96000 };

	static final int MAX_MILLISECONDS = 86_400_000;

	public static final MediaSchema SCHEMA = MediaSchema.of(MediaKind.AUDIO, List.of(convert()), formats(),
			new MediaSchema.OutputFormat(AudioOperation.CONVERT, "f", "wav"));

	private AudioSchemas() {
	}

	private static OperationSchema convert() {
		return OperationSchema.of(AudioOperation.CONVERT) //
			.param(of("f", ParamType.oneOf("mp3", "m4a", "flac", "oga", "ac3", "opus", "amr")).mandatory()) //
			.param(of("ss", between(0, MAX_MILLISECONDS))) //
			.param(of("t", between(1, MAX_MILLISECONDS))) //
			.param(of("ar", ParamType.oneOf(SAMPLE_RATES))) //
			.param(of("ac", between(1, 8))) //
			.param(of("aq", between(0, 100)).exclusive("rate")) //
			.param(of("ab", between(1000, 10_000_000)).exclusive("rate")) //
			.param(of("abopt", ParamType.oneOf(0, 1, 2)).onlyWhen(whenPresent("ab"))) //
			.param(of("adepth", ParamType.oneOf(16, 24)).onlyWhen(whenEquals("f", "flac"))) //
			.build();
	}

	private static FormatConstraintTable formats() {
		var allRates = oneOf(SAMPLE_RATES);
		return FormatConstraintTable.of(Set.of("ar", "ac", "ab", "aq", "adepth"), //
				FormatConstraints.of("mp3", "audio/mpeg")
					.allow("ar", oneOf(8000, 11025, 12000, 16000, 22050, 24000, 32000, 44100, 48000))
					.allow("ac", range(1, 2))
					.allow("ab", range(8_000, 320_000))
					.allow("aq", range(0, 100)), //
				FormatConstraints.of("m4a", "audio/mp4")
					.allow("ar", allRates)
					.allow("ac", range(1, 8))
					.allow("ab", range(8_000, 512_000))
					.allow("aq", range(0, 100)), //
				FormatConstraints.of("flac", "audio/flac")
					.allow("ar", allRates)
					.allow("ac", range(1, 8))
					.allow("adepth", oneOf(16, 24)), //
				FormatConstraints.of("oga", "audio/ogg")
					.allow("ar", allRates)
					.allow("ac", range(1, 8))
					.allow("ab", range(8_000, 500_000))
					.allow("aq", range(0, 100)), //
				FormatConstraints.of("ac3", "audio/ac3")
					.allow("ar", oneOf(32000, 44100, 48000))
					.allow("ac", range(1, 6))
					.allow("ab", range(32_000, 640_000)), //
				FormatConstraints.of("opus", "audio/opus")
					.allow("ar", oneOf(8000, 12000, 16000, 24000, 48000))
					.allow("ac", range(1, 8))
					.allow("ab", range(6_000, 510_000)), //
				FormatConstraints.of("amr", "audio/amr")
					.allow("ar", oneOf(8000))
					.allow("ac", range(1, 1))
					.allow("ab", range(4_750, 12_200))
					.defaultTo("ar", 8000)
					.defaultTo("ac", 1), //
				FormatConstraints.of("wav", "audio/wav"));
	}

}

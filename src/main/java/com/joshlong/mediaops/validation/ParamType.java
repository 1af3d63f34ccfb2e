package com.joshlong.mediaops.validation;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * the declared type of a parameter. Each type knows how to turn the raw string from the
 * operations string into a typed value, and rejects anything outside its domain with an
 * {@link IllegalArgumentException} whose message is the reason.
 */
public sealed interface ParamType permits ParamType.BoundedInteger, ParamType.IntegerChoice, ParamType.Choice,
		ParamType.HexColor, ParamType.Percentage, ParamType.Flag, ParamType.Text, ParamType.PageRange,
		ParamType.Base64Text {

	Object coerce(String raw);

	String describe();

	static ParamType between(int min, int max) {
		return new BoundedInteger(min, max);
	}

	static ParamType oneOf(String... values) {
		return new Choice(Set.of(values));
	}

	static ParamType oneOf(int... values) {
		var set = new TreeSet<Integer>();
		for (var v : values)
			set.add(v);
		return new IntegerChoice(Collections.unmodifiableSortedSet(set));
	}

	static ParamType hexColor() {
		return new HexColor();
	}

	static ParamType percentage() {
		return new Percentage();
	}

	static ParamType flag() {
		return new Flag();
	}

	static ParamType text(int maxLength) {
		return new Text(maxLength);
	}

	static ParamType pages() {
		return new PageRange(PageRange.MAX_PAGES);
	}

	static ParamType base64Text() {
		return new Base64Text();
	}

	private static int parseInt(String raw) {
		try {
			return Integer.parseInt(raw);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("[" + raw + "] is not an integer");
		}
	}

	record BoundedInteger(int min, int max) implements ParamType {

		@Override
		public Object coerce(String raw) {
			var value = parseInt(raw);
			if (value < this.min || value > this.max)
				throw new IllegalArgumentException("[" + raw + "] must be " + describe());
			return value;
		}

		@Override
		public String describe() {
			return "an integer between " + this.min + " and " + this.max;
		}
	}

	record IntegerChoice(Set<Integer> values) implements ParamType {

		@Override
		public Object coerce(String raw) {
			var value = parseInt(raw);
			if (!this.values.contains(value))
				throw new IllegalArgumentException("[" + raw + "] must be " + describe());
			return value;
		}

		@Override
		public String describe() {
			return "one of " + this.values;
		}
	}

	record Choice(Set<String> values) implements ParamType {

		@Override
		public Object coerce(String raw) {
			if (!this.values.contains(raw))
				throw new IllegalArgumentException("[" + raw + "] must be " + describe());
			return raw;
		}

		@Override
		public String describe() {
			return "one of " + new TreeSet<>(this.values);
		}
	}

	record HexColor() implements ParamType {

		private static final Pattern HEX = Pattern.compile("^[0-9A-Fa-f]{6}$");

		@Override
		public Object coerce(String raw) {
			if (!HEX.matcher(raw).matches())
				throw new IllegalArgumentException("[" + raw + "] must be " + describe());
			return raw.toUpperCase();
		}

		@Override
		public String describe() {
			return "a color of six hexadecimal digits";
		}
	}

	record Percentage() implements ParamType {

		@Override
		public Object coerce(String raw) {
			var value = parseInt(raw);
			if (value < 1 || value > 100)
				throw new IllegalArgumentException("[" + raw + "] must be " + describe());
			return value;
		}

		@Override
		public String describe() {
			return "a percentage between 1 and 100";
		}
	}

	record Flag() implements ParamType {

		@Override
		public Object coerce(String raw) {
			return switch (raw) {
				case "1" -> Boolean.TRUE;
				case "0" -> Boolean.FALSE;
				default -> throw new IllegalArgumentException("[" + raw + "] must be " + describe());
			};
		}

		@Override
		public String describe() {
			return "0 or 1";
		}
	}

	record Text(int maxLength) implements ParamType {

		private static final Pattern SAFE = Pattern.compile("^[\\p{L}\\p{N}._-]+$");

		@Override
		public Object coerce(String raw) {
			if (raw.length() > this.maxLength || !SAFE.matcher(raw).matches())
				throw new IllegalArgumentException("[" + raw + "] must be " + describe());
			return raw;
		}

		@Override
		public String describe() {
			return "text of letters, digits, '.', '_' or '-', at most " + this.maxLength + " characters";
		}
	}

	/**
	 * either a direct page or page span ({@code 3}, {@code 4-10}) or the url-safe base64
	 * encoding of a list like {@code 1,2,4-10}. Coerces to a sorted list of distinct page
	 * numbers.
	 */
	record PageRange(int maxPages) implements ParamType {

		static final int MAX_PAGES = 10_000;

		private static final Pattern DIRECT = Pattern.compile("^\\d+(-\\d+)?$");

		@Override
		public Object coerce(String raw) {
			var spec = DIRECT.matcher(raw).matches() ? raw : Base64Text.decode(raw);
			var pages = new TreeSet<Integer>();
			for (var part : spec.split(",")) {
				var trimmed = part.trim();
				var dash = trimmed.indexOf('-');
				var start = parseInt(dash == -1 ? trimmed : trimmed.substring(0, dash));
				var end = dash == -1 ? start : parseInt(trimmed.substring(dash + 1));
				if (start < 1 || end < start)
					throw new IllegalArgumentException("[" + trimmed + "] is not a valid page range");
				if (end - start >= this.maxPages || pages.size() + (end - start) >= this.maxPages)
					throw new IllegalArgumentException("at most " + this.maxPages + " pages may be selected");
				for (var page = start; page <= end; page++)
					pages.add(page);
			}
			return List.copyOf(new ArrayList<>(pages));
		}

		@Override
		public String describe() {
			return "a page range like 3 or 4-10, or the url-safe base64 encoding of a list like 1,2,4-10";
		}
	}

	record Base64Text() implements ParamType {

		static String decode(String raw) {
			String decoded;
			try {
				decoded = new String(Base64.getUrlDecoder().decode(raw), StandardCharsets.UTF_8);
			} //
			catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("[" + raw + "] is not url-safe base64", e);
			}
			if (decoded.isBlank())
				throw new IllegalArgumentException("[" + raw + "] decodes to nothing");
			return decoded;
		}

		@Override
		public Object coerce(String raw) {
			return decode(raw);
		}

		@Override
		public String describe() {
			return "url-safe base64 text";
		}
	}

}

package com.joshlong.mediaops.validation;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * a condition on sibling parameters that must hold for a parameter to be given at all.
 */
public sealed interface Applicability permits Applicability.WhenPresent, Applicability.WhenEquals {

	boolean test(Map<String, String> siblings);

	String describe();

	static Applicability whenPresent(String... keys) {
		return new WhenPresent(List.of(keys));
	}

	static Applicability whenEquals(String key, String... values) {
		return new WhenEquals(key, Set.copyOf(Arrays.asList(values)));
	}

	record WhenPresent(List<String> keys) implements Applicability {

		@Override
		public boolean test(Map<String, String> siblings) {
			return this.keys.stream().anyMatch(siblings::containsKey);
		}

		@Override
		public String describe() {
			return "when one of " + this.keys + " is given";
		}
	}

	record WhenEquals(String key, Set<String> values) implements Applicability {

		@Override
		public boolean test(Map<String, String> siblings) {
			return siblings.containsKey(this.key) && this.values.contains(siblings.get(this.key));
		}

		@Override
		public String describe() {
			return "when [" + this.key + "] is one of " + new TreeSet<>(this.values);
		}
	}

}

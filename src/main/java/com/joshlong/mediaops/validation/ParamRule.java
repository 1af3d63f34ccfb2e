package com.joshlong.mediaops.validation;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * a constraint across several parameters of the same stage, checked once every value has
 * been coerced and defaulted.
 */
public sealed interface ParamRule permits ParamRule.AtLeastOneOf, ParamRule.AllRequiredWhen {

	/**
	 * @param given the keys the caller supplied
	 * @param values the coerced values, defaults included
	 * @return the offending key and reason, if the rule is broken
	 */
	Optional<Violation> check(Set<String> given, Map<String, Object> values);

	record Violation(String key, String reason) {
	}

	static ParamRule atLeastOneOf(String... keys) {
		return new AtLeastOneOf(List.of(keys));
	}

	static ParamRule allRequiredWhen(String key, Set<String> values, String... required) {
		return new AllRequiredWhen(key, values, List.of(required));
	}

	record AtLeastOneOf(List<String> keys) implements ParamRule {

		@Override
		public Optional<Violation> check(Set<String> given, Map<String, Object> values) {
			if (this.keys.stream().anyMatch(given::contains))
				return Optional.empty();
			return Optional.of(new Violation(String.join("|", this.keys), "at least one of " + this.keys + " is required"));
		}
	}

	record AllRequiredWhen(String key, Set<String> values, List<String> required) implements ParamRule {

		@Override
		public Optional<Violation> check(Set<String> given, Map<String, Object> values) {
			var value = values.get(this.key);
			if (value == null || !this.values.contains(String.valueOf(value)))
				return Optional.empty();
			return this.required.stream()
				.filter(k -> !given.contains(k))
				.findFirst()
				.map(missing -> new Violation(missing,
						"is required when [" + this.key + "] is one of " + new TreeSet<>(this.values)
								+ "; all of " + this.required + " must be given"));
		}
	}

}

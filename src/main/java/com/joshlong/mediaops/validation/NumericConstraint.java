package com.joshlong.mediaops.validation;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * what an output format accepts for one governed numeric parameter.
 */
public sealed interface NumericConstraint permits NumericConstraint.OneOf, NumericConstraint.Range {

	boolean allows(int value);

	String describe();

	static NumericConstraint oneOf(int... values) {
		var set = new TreeSet<Integer>();
		for (var v : values)
			set.add(v);
		return new OneOf(Collections.unmodifiableSortedSet(set));
	}

	static NumericConstraint range(int min, int max) {
		return new Range(min, max);
	}

	record OneOf(SortedSet<Integer> values) implements NumericConstraint {

		@Override
		public boolean allows(int value) {
			return this.values.contains(value);
		}

		@Override
		public String describe() {
			return "one of " + this.values;
		}
	}

	record Range(int min, int max) implements NumericConstraint {

		@Override
		public boolean allows(int value) {
			return value >= this.min && value <= this.max;
		}

		@Override
		public String describe() {
			return "between " + this.min + " and " + this.max;
		}
	}

}

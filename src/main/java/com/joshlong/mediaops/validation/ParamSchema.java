package com.joshlong.mediaops.validation;

import org.springframework.util.Assert;

/**
 * describes one parameter of one operation. Instances are built with {@link #of} and
 * refined with the {@code with}-style methods, each of which returns a copy.
 *
 * @param key the name as written in the operations string
 * @param type the declared type
 * @param defaultValue the raw default, or {@code null}
 * @param required whether the parameter must be given
 * @param exclusion the exclusivity group this parameter belongs to, or {@code null}
 * @param applicability the sibling condition under which the parameter may be given, or
 * {@code null}
 */
public record ParamSchema(String key, ParamType type, String defaultValue, boolean required, Exclusion exclusion,
		Applicability applicability) {

	/**
	 * keys sharing a {@code group} but declaring a different {@code alternative} may not
	 * appear together.
	 */
	public record Exclusion(String group, String alternative) {
	}

	public ParamSchema {
		Assert.hasText(key, "the key must not be empty");
		Assert.notNull(type, "the type must not be null");
		Assert.state(!(required && defaultValue != null), "a required parameter can not have a default");
	}

	public static ParamSchema of(String key, ParamType type) {
		return new ParamSchema(key, type, null, false, null, null);
	}

	public ParamSchema defaultsTo(String value) {
		return new ParamSchema(this.key, this.type, value, this.required, this.exclusion, this.applicability);
	}

	public ParamSchema mandatory() {
		return new ParamSchema(this.key, this.type, this.defaultValue, true, this.exclusion, this.applicability);
	}

	public ParamSchema exclusive(String group, String alternative) {
		return new ParamSchema(this.key, this.type, this.defaultValue, this.required,
				new Exclusion(group, alternative), this.applicability);
	}

	public ParamSchema exclusive(String group) {
		return exclusive(group, this.key);
	}

	public ParamSchema onlyWhen(Applicability applicability) {
		return new ParamSchema(this.key, this.type, this.defaultValue, this.required, this.exclusion, applicability);
	}

	public boolean isFlag() {
		return this.type instanceof ParamType.Flag;
	}

}

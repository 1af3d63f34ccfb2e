package com.joshlong.mediaops.validation;

import com.joshlong.mediaops.operations.Operation;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * the declared parameters of one operation, the key a bare value token stands for, and
 * the rules that span several parameters.
 */
public final class OperationSchema {

	private final Operation operation;

	private final Map<String, ParamSchema> params;

	private final String positionalKey;

	private final List<ParamRule> rules;

	private OperationSchema(Operation operation, Map<String, ParamSchema> params, String positionalKey,
			List<ParamRule> rules) {
		this.operation = operation;
		this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
		this.positionalKey = positionalKey;
		this.rules = List.copyOf(rules);
	}

	public static Builder of(Operation operation) {
		return new Builder(operation);
	}

	public Operation operation() {
		return this.operation;
	}

	public Map<String, ParamSchema> params() {
		return this.params;
	}

	public Optional<ParamSchema> param(String key) {
		return Optional.ofNullable(this.params.get(key));
	}

	public Optional<String> positionalKey() {
		return Optional.ofNullable(this.positionalKey);
	}

	public List<ParamRule> rules() {
		return this.rules;
	}

	public static final class Builder {

		private final Operation operation;

		private final Map<String, ParamSchema> params = new LinkedHashMap<>();

		private final List<ParamRule> rules = new ArrayList<>();

		private String positionalKey;

		private Builder(Operation operation) {
			Assert.notNull(operation, "the operation must not be null");
			this.operation = operation;
		}

		public Builder param(ParamSchema param) {
			Assert.state(!this.params.containsKey(param.key()),
					() -> "the key [" + param.key() + "] is declared twice for " + this.operation.operationName());
			this.params.put(param.key(), param);
			return this;
		}

		public Builder positional(String key) {
			this.positionalKey = key;
			return this;
		}

		public Builder rule(ParamRule rule) {
			this.rules.add(rule);
			return this;
		}

		public OperationSchema build() {
			Assert.state(this.positionalKey == null || this.params.containsKey(this.positionalKey),
					() -> "the positional key [" + this.positionalKey + "] is not declared for "
							+ this.operation.operationName());
			return new OperationSchema(this.operation, this.params, this.positionalKey, this.rules);
		}

	}

}

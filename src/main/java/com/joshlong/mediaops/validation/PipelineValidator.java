package com.joshlong.mediaops.validation;

import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.operations.OperationSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * checks parsed stages against the schema tables of their media kind and produces an
 * immutable {@link Pipeline}. Nothing is fetched, written or run here: any problem surfaces
 * as an {@link OperationValidationException} before there are side effects.
 */
@Component
public class PipelineValidator {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final SchemaRegistry registry;

	public PipelineValidator(SchemaRegistry registry) {
		this.registry = registry;
	}

	/**
	 * @param kind the media kind of every stage
	 * @param specs the parsed stages
	 * @param sourceFormat the format of the source object, usually its key's extension, or
	 * {@code null} if it has none
	 */
	public Pipeline validate(MediaKind kind, List<OperationSpec> specs, String sourceFormat) {
		var schema = this.registry.schema(kind);
		var stages = new ArrayList<Stage>(specs.size());
		for (var spec : specs) {
			Assert.state(spec.operation().kind() == kind,
					() -> spec.operation().operationName() + " is not a " + kind + " operation");
			var operationSchema = schema.operation(spec.operation())
				.orElseThrow(() -> new IllegalStateException("there is no schema for " + spec.operation()));
			stages.add(new Stage(spec.operation(), this.validateStage(operationSchema, spec), spec.position()));
		}
		var outputFormat = this.resolveOutputFormat(schema, stages, sourceFormat);
		var constraints = schema.formats().lookup(outputFormat);
		this.checkFormatConstraints(schema, stages, outputFormat, constraints.orElse(null));
		var withDefaults = constraints.map(c -> this.fillFormatDefaults(schema, stages, c)).orElse(stages);
		var contentType = constraints.map(FormatConstraints::contentType).orElse("application/octet-stream");
		var pipeline = new Pipeline(kind, withDefaults, outputFormat, contentType);
		this.log.debug("validated {} stage(s) of {} producing [{}]", stages.size(), kind, outputFormat);
		return pipeline;
	}

	private StageParameters validateStage(OperationSchema schema, OperationSpec spec) {
		var name = schema.operation().operationName();
		var raw = this.resolveBareTokens(schema, spec);

		// exclusivity
		var alternatives = new HashMap<String, String>();
		var keysByAlternative = new HashMap<String, String>();
		for (var key : raw.keySet()) {
			var exclusion = schema.params().get(key).exclusion();
			if (exclusion == null)
				continue;
			var seen = alternatives.putIfAbsent(exclusion.group(), exclusion.alternative());
			if (seen != null && !seen.equals(exclusion.alternative()))
				throw new OperationValidationException(name, key,
						"can not be combined with [" + keysByAlternative.get(exclusion.group()) + "]");
			keysByAlternative.putIfAbsent(exclusion.group(), key);
		}

		// applicability
		for (var key : raw.keySet()) {
			var applicability = schema.params().get(key).applicability();
			if (applicability != null && !applicability.test(raw))
				throw new OperationValidationException(name, key, "only applies " + applicability.describe());
		}

		// coercion
		var values = new LinkedHashMap<String, Object>();
		for (var entry : raw.entrySet()) {
			var param = schema.params().get(entry.getKey());
			values.put(entry.getKey(), this.coerce(name, param, entry.getValue()));
		}

		// defaults and required keys
		for (var param : schema.params().values()) {
			if (raw.containsKey(param.key()))
				continue;
			if (param.required())
				throw new OperationValidationException(name, param.key(), "is required");
			var applies = param.applicability() == null || param.applicability().test(raw);
			if (param.defaultValue() != null && applies)
				values.put(param.key(), this.coerce(name, param, param.defaultValue()));
		}

		for (var rule : schema.rules()) {
			var violation = rule.check(raw.keySet(), values);
			if (violation.isPresent())
				throw new OperationValidationException(name, violation.get().key(), violation.get().reason());
		}
		return new StageParameters(values, raw.keySet());
	}

	private Map<String, String> resolveBareTokens(OperationSchema schema, OperationSpec spec) {
		var name = schema.operation().operationName();
		var positional = schema.positionalKey().orElse(null);
		var raw = new LinkedHashMap<String, String>();
		for (var entry : spec.params().entrySet()) {
			var key = entry.getKey();
			var value = entry.getValue();
			var param = schema.param(key);
			if (value.isEmpty()) {
				if (param.isPresent() && param.get().isFlag()) {
					raw.put(key, "1");
					continue;
				}
				if (param.isEmpty() && positional != null && !spec.params().containsKey(positional)
						&& !raw.containsKey(positional)) {
					raw.put(positional, key);
					continue;
				}
				if (param.isPresent())
					throw new OperationValidationException(name, key, "needs a value");
			}
			if (param.isEmpty())
				throw new OperationValidationException(name, key, "is not a parameter of " + name);
			raw.put(key, value);
		}
		return raw;
	}

	private Object coerce(String operation, ParamSchema param, String raw) {
		try {
			return param.type().coerce(raw);
		}
		catch (IllegalArgumentException e) {
			throw new OperationValidationException(operation, param.key(), e.getMessage());
		}
	}

	private String resolveOutputFormat(MediaSchema schema, List<Stage> stages, String sourceFormat) {
		var outputFormat = schema.outputFormat();
		for (var i = stages.size() - 1; i >= 0; i--) {
			var stage = stages.get(i);
			if (stage.operation() == outputFormat.operation() && stage.parameters().has(outputFormat.key()))
				return String.valueOf(stage.parameters().asMap().get(outputFormat.key()));
		}
		if (sourceFormat != null) {
			var known = schema.formats().lookup(sourceFormat);
			if (known.isPresent())
				return known.get().format();
			if (stages.isEmpty())
				return sourceFormat.toLowerCase(Locale.ROOT);
		}
		return outputFormat.fallback();
	}

	private void checkFormatConstraints(MediaSchema schema, List<Stage> stages, String format,
			FormatConstraints constraints) {
		for (var stage : stages) {
			var parameters = stage.parameters();
			for (var entry : parameters.asMap().entrySet()) {
				var key = entry.getKey();
				if (!schema.formats().governs(key) || !parameters.given(key))
					continue;
				var name = stage.operation().operationName();
				var constraint = constraints == null ? null : constraints.constraint(key).orElse(null);
				if (constraint == null)
					throw new OperationValidationException(name, key, "is not supported by the format [" + format + "]");
				if (entry.getValue() instanceof Integer value && !constraint.allows(value))
					throw new OperationValidationException(name, key,
							"[" + value + "] is not supported by the format [" + format + "], which needs "
									+ constraint.describe());
			}
		}
	}

	/**
	 * governed keys the caller left out take the format's defaults, on the stage that
	 * selected the format.
	 */
	private List<Stage> fillFormatDefaults(MediaSchema schema, List<Stage> stages, FormatConstraints constraints) {
		if (constraints.defaults().isEmpty())
			return stages;
		var outputFormat = schema.outputFormat();
		for (var i = stages.size() - 1; i >= 0; i--) {
			var stage = stages.get(i);
			if (stage.operation() != outputFormat.operation() || !stage.parameters().has(outputFormat.key()))
				continue;
			var parameters = stage.parameters();
			for (var entry : constraints.defaults().entrySet())
				if (!parameters.has(entry.getKey()))
					parameters = parameters.with(entry.getKey(), entry.getValue());
			var copy = new ArrayList<>(stages);
			copy.set(i, new Stage(stage.operation(), parameters, stage.position()));
			return copy;
		}
		return stages;
	}

}

package com.joshlong.mediaops.operations;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

/**
 * turns strings like {@code resize,w_800/crop,w_200,h_200,g_center} into an ordered list
 * of {@link OperationSpec stages}. Stages are separated by {@code /}, tokens by
 * {@code ,}. The first token names the operation; every other token is either a bare
 * flag or a {@code key_value} pair split on the first underscore.
 * <p>
 * This knows nothing about which parameters are valid, only about syntax.
 */
@Component
public class OperationsParser {

	static final String STAGE_DELIMITER = "/";

	static final String TOKEN_DELIMITER = ",";

	static final char KEY_VALUE_DELIMITER = '_';

	private final Logger log = LoggerFactory.getLogger(getClass());

	public List<OperationSpec> parse(MediaKind kind, String operations) {
		if (!StringUtils.hasText(operations))
			return List.of();
		var stages = operations.split(STAGE_DELIMITER, -1);
		var specs = new ArrayList<OperationSpec>(stages.length);
		for (var position = 0; position < stages.length; position++) {
			specs.add(this.parseStage(kind, stages[position], position));
		}
		this.log.debug("parsed [{}] into {} {} stage(s)", operations, specs.size(), kind);
		return List.copyOf(specs);
	}

	private OperationSpec parseStage(MediaKind kind, String stage, int position) {
		if (!StringUtils.hasText(stage))
			throw new OperationParseException(position, "the stage is empty");
		var tokens = stage.split(TOKEN_DELIMITER, -1);
		var name = tokens[0].trim();
		var operation = Operation.lookup(kind, name)
			.orElseThrow(() -> new OperationParseException(position,
					"[" + name + "] is not a " + kind.name().toLowerCase(Locale.ROOT) + " operation"));
		var params = new LinkedHashMap<String, String>();
		for (var i = 1; i < tokens.length; i++) {
			var token = tokens[i].trim();
			var split = token.indexOf(KEY_VALUE_DELIMITER);
			var key = split == -1 ? token : token.substring(0, split);
			var value = split == -1 ? "" : token.substring(split + 1);
			if (!StringUtils.hasText(key))
				throw new OperationParseException(position,
						"the token [" + token + "] of operation [" + name + "] has no key");
			if (params.containsKey(key))
				throw new OperationParseException(position,
						"the key [" + key + "] appears more than once in operation [" + name + "]");
			params.put(key, value);
		}
		return new OperationSpec(operation, params, position);
	}

}

package com.joshlong.mediaops.execution;

import com.joshlong.mediaops.validation.StageParameters;

/**
 * applies one operation to the current context.
 */
@FunctionalInterface
public interface OperationHandler {

	MediaContext apply(MediaContext context, StageParameters parameters) throws Exception;

}

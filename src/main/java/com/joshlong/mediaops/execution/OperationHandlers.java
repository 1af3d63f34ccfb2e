package com.joshlong.mediaops.execution;

import com.joshlong.mediaops.operations.MediaKind;
import com.joshlong.mediaops.operations.Operation;

/**
 * the handlers of one media kind. Implementations dispatch with a {@code switch} over
 * their operation enum, so an operation without a handler does not compile.
 *
 * @param <O> the operation enum of the media kind
 */
public interface OperationHandlers<O extends Enum<O> & Operation> {

	MediaKind kind();

	Class<O> operationType();

	OperationHandler handlerFor(O operation);

}

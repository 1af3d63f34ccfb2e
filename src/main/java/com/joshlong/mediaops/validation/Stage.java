package com.joshlong.mediaops.validation;

import com.joshlong.mediaops.operations.Operation;

/**
 * one validated stage.
 */
public record Stage(Operation operation, StageParameters parameters, int position) {
}

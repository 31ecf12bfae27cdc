package com.palmid.palm.exception;

import com.palmid.common.exception.BusinessException;
import com.palmid.palm.template.BuildFailure;

/**
 * Thrown when a landmark set cannot be turned into a palm template.
 */
public class TemplateBuildException extends BusinessException {

    private final BuildFailure failure;

    public TemplateBuildException(BuildFailure failure, String reason) {
        super(failure.getErrorCode(), reason);
        this.failure = failure;
    }

    public BuildFailure getFailure() {
        return failure;
    }
}

package com.palmid.palm.template;

import com.palmid.common.exception.ErrorCode;

public enum BuildFailure {
    /** A knuckle landmark was detected below the minimum confidence. */
    INSUFFICIENT_CONFIDENCE(ErrorCode.BIO_DETECTION_FAILED),
    /** The wrist to middle knuckle reference distance is absent or zero. */
    MISSING_REFERENCE(ErrorCode.BIO_MISSING_REFERENCE);

    private final ErrorCode errorCode;

    BuildFailure(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}

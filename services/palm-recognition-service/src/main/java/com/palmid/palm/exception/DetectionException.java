package com.palmid.palm.exception;

import com.palmid.common.exception.BusinessException;
import com.palmid.palm.detection.DetectionError;

/**
 * Thrown by a keypoint provider when it cannot produce a landmark set.
 */
public class DetectionException extends BusinessException {

    private final DetectionError error;

    public DetectionException(DetectionError error, String reason) {
        this(error, reason, null);
    }

    public DetectionException(DetectionError error, String reason, Throwable cause) {
        super(error.getErrorCode(), reason, cause);
        this.error = error;
    }

    public DetectionError getError() {
        return error;
    }
}

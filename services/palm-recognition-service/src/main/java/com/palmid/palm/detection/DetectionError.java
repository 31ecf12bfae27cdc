package com.palmid.palm.detection;

import com.palmid.common.exception.ErrorCode;

/**
 * Why a keypoint provider could not return landmarks.
 */
public enum DetectionError {
    /** No usable detection model is loaded. */
    UNAVAILABLE(ErrorCode.BIO_NOT_AVAILABLE),
    /** No hand was found in the image, or the image could not be read. */
    NOT_FOUND(ErrorCode.BIO_DETECTION_FAILED),
    /** The provider did not answer within the request deadline. */
    TIMEOUT(ErrorCode.BIO_TIMEOUT);

    private final ErrorCode errorCode;

    DetectionError(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}

package com.palmid.common.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Base exception for all business-related failures.
 *
 * Carries a typed {@link ErrorCode}, a caller-facing reason (the message without the
 * code prefix) and a unique error ID for log correlation.
 *
 * USAGE PATTERNS:
 * 1. Simple construction: new BusinessException(ErrorCode.XXX, "reason")
 * 2. With cause: new BusinessException(ErrorCode.XXX, "reason", cause)
 */
@Getter
public class BusinessException extends RuntimeException {

    private final String errorId;
    private final ErrorCode errorCode;
    private final String reason;

    public BusinessException(ErrorCode errorCode, String reason) {
        this(errorCode, reason, null);
    }

    public BusinessException(ErrorCode errorCode, String reason, Throwable cause) {
        super(buildMessage(errorCode, reason), cause);
        this.errorId = UUID.randomUUID().toString();
        this.errorCode = errorCode != null ? errorCode : ErrorCode.SYS_INTERNAL_ERROR;
        this.reason = reason != null ? reason : this.errorCode.getDefaultMessage();
    }

    /**
     * String form of the error code, e.g. {@code BIO_005}
     */
    public String getCode() {
        return errorCode.getCode();
    }

    private static String buildMessage(ErrorCode errorCode, String reason) {
        if (errorCode == null) {
            return reason != null ? reason : "Business error occurred";
        }
        return String.format("[%s] %s", errorCode.getCode(),
            reason != null ? reason : errorCode.getDefaultMessage());
    }

    @Override
    public String toString() {
        return String.format("%s[errorId=%s, errorCode=%s, message=%s]",
            getClass().getSimpleName(), errorId, errorCode.getCode(), getMessage());
    }
}

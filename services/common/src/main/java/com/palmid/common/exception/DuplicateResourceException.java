package com.palmid.common.exception;

/**
 * Exception thrown when a resource already exists
 */
public class DuplicateResourceException extends BusinessException {

    public DuplicateResourceException(ErrorCode errorCode, String resourceName, String fieldName, Object fieldValue) {
        super(errorCode, String.format("%s already exists with %s: %s", resourceName, fieldName, fieldValue));
    }
}

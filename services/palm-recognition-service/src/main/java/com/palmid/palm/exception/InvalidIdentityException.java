package com.palmid.palm.exception;

import com.palmid.common.exception.BusinessException;
import com.palmid.common.exception.ErrorCode;

public class InvalidIdentityException extends BusinessException {

    public InvalidIdentityException(String reason) {
        super(ErrorCode.VAL_INVALID_IDENTITY, reason);
    }
}

package com.palmid.palm.exception;

import com.palmid.common.exception.BusinessException;
import com.palmid.common.exception.ErrorCode;

/**
 * I/O failure in the palm template store.
 */
public class PalmStorageException extends BusinessException {

    public PalmStorageException(String reason, Throwable cause) {
        super(ErrorCode.FILE_STORAGE_ERROR, reason, cause);
    }
}

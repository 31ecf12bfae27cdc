package com.palmid.palm.exception;

import com.palmid.common.exception.DuplicateResourceException;
import com.palmid.common.exception.ErrorCode;

/**
 * Thrown when registering an identity that already has a live registration.
 */
public class DuplicateRegistrationException extends DuplicateResourceException {

    public DuplicateRegistrationException(String identity) {
        super(ErrorCode.BIO_ALREADY_REGISTERED, "Palm registration", "identity", identity);
    }
}

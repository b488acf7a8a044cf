package com.nursery.service;

/**
 * Raised for an unknown username and for a wrong password alike.
 */
public class InvalidCredentialsException extends NurseryApiException {

    public InvalidCredentialsException() {
        super(ErrorCode.INVALID_CREDENTIALS);
    }
}

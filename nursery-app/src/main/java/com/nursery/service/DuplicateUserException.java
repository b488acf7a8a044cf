package com.nursery.service;

public class DuplicateUserException extends NurseryApiException {

    public DuplicateUserException() {
        super(ErrorCode.DUPLICATE_USER);
    }

    public DuplicateUserException(Throwable cause) {
        super(ErrorCode.DUPLICATE_USER, ErrorCode.DUPLICATE_USER.defaultDetail(), cause);
    }
}

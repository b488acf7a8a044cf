package com.nursery.service;

/**
 * Base for failures that end a request with a client-facing reason code.
 */
public abstract class NurseryApiException extends RuntimeException {

    private final ErrorCode errorCode;

    protected NurseryApiException(ErrorCode errorCode) {
        this(errorCode, errorCode.defaultDetail());
    }

    protected NurseryApiException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    protected NurseryApiException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}

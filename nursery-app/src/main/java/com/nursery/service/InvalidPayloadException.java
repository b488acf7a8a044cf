package com.nursery.service;

public class InvalidPayloadException extends NurseryApiException {

    public InvalidPayloadException(String detail) {
        super(ErrorCode.INVALID_PAYLOAD, detail);
    }

    public InvalidPayloadException(String detail, Throwable cause) {
        super(ErrorCode.INVALID_PAYLOAD, detail, cause);
    }
}

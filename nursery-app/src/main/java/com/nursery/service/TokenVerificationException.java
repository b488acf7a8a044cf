package com.nursery.service;

public class TokenVerificationException extends NurseryApiException {

    private TokenVerificationException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, errorCode.defaultDetail(), cause);
    }

    public static TokenVerificationException expired() {
        return new TokenVerificationException(ErrorCode.TOKEN_EXPIRED, null);
    }

    public static TokenVerificationException invalid() {
        return new TokenVerificationException(ErrorCode.TOKEN_INVALID, null);
    }

    public static TokenVerificationException invalid(Throwable cause) {
        return new TokenVerificationException(ErrorCode.TOKEN_INVALID, cause);
    }
}

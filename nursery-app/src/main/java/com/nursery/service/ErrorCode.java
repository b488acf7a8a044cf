package com.nursery.service;

import org.springframework.http.HttpStatus;

/**
 * Reason codes returned in API error bodies, with their HTTP status and default detail.
 */
public enum ErrorCode {

    DUPLICATE_USER(HttpStatus.BAD_REQUEST, "DuplicateUser", "Username already exists"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "InvalidCredentials", "Invalid credentials"),
    TOKEN_MISSING(HttpStatus.UNAUTHORIZED, "TokenMissing", "Not authenticated"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "TokenExpired", "Token expired"),
    TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "TokenInvalid", "Invalid token"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "NotFound", "Item not found"),
    INVALID_PAYLOAD(HttpStatus.UNPROCESSABLE_ENTITY, "InvalidPayload", "Invalid request body");

    private final HttpStatus status;
    private final String code;
    private final String defaultDetail;

    ErrorCode(HttpStatus status, String code, String defaultDetail) {
        this.status = status;
        this.code = code;
        this.defaultDetail = defaultDetail;
    }

    public HttpStatus status() { return status; }

    public String code() { return code; }

    public String defaultDetail() { return defaultDetail; }
}

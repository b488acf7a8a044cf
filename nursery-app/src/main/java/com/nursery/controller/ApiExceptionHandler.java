package com.nursery.controller;

import com.nursery.model.ApiError;
import com.nursery.service.ErrorCode;
import com.nursery.service.NurseryApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain failures to {@code {"code", "detail"}} bodies with the matching status.
 * Anything else, storage errors included, is left to Spring's default 500 handling.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NurseryApiException.class)
    public ResponseEntity<ApiError> handleApiException(NurseryApiException e) {
        ErrorCode errorCode = e.getErrorCode();
        log.debug("Request failed with {}: {}", errorCode.code(), e.getMessage());
        return toResponse(errorCode, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        return toResponse(ErrorCode.INVALID_PAYLOAD, "Malformed request body");
    }

    private static ResponseEntity<ApiError> toResponse(ErrorCode errorCode, String detail) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(errorCode.status());
        if (errorCode.status() == HttpStatus.UNAUTHORIZED) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return builder.body(new ApiError(errorCode.code(), detail));
    }
}

package com.nursery.service;

/**
 * Covers both a missing id and an id owned by someone else.
 */
public class RecordNotFoundException extends NurseryApiException {

    public RecordNotFoundException() {
        super(ErrorCode.NOT_FOUND);
    }

    public RecordNotFoundException(String detail) {
        super(ErrorCode.NOT_FOUND, detail);
    }
}

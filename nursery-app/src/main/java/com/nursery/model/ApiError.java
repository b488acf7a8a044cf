package com.nursery.model;

public record ApiError(
    String code,
    String detail
) {}

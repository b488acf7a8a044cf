package com.nursery.model;

public record Credentials(
    String username,
    String password
) {}

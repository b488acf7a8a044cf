package com.nursery.model;

import java.time.Instant;

/**
 * Stored credential for a registered user.
 * Only the BCrypt hash of the password is ever kept.
 */
public record AppUser(
    String username,
    String passwordHash,
    Instant createdAt
) {}

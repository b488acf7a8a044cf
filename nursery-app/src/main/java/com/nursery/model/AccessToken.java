package com.nursery.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AccessToken(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    String username
) {

    public static AccessToken bearer(String token, String username) {
        return new AccessToken(token, "bearer", username);
    }
}

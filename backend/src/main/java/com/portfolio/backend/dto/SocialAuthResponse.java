package com.portfolio.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SocialAuthResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        String provider
) {
    public static SocialAuthResponse bearer(String accessToken, String provider) {
        return new SocialAuthResponse(accessToken, "bearer", provider);
    }
}

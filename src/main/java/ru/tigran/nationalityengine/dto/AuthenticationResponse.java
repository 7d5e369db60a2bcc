package ru.tigran.nationalityengine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Bearer token issued on registration and login.
 */
@Schema(description = "Bearer token for the Authorization header")
public record AuthenticationResponse(
        @JsonProperty("access_token")
        String accessToken,

        @Schema(example = "Bearer")
        @JsonProperty("token_type")
        String tokenType,

        @Schema(description = "Token lifetime in seconds", example = "86400")
        @JsonProperty("expires_in")
        long expiresIn,

        @JsonProperty("user_id")
        Long userId
) {
    private static final String BEARER = "Bearer";

    public static AuthenticationResponse bearer(Long userId, String accessToken, long expiresIn) {
        return new AuthenticationResponse(accessToken, BEARER, expiresIn, userId);
    }
}

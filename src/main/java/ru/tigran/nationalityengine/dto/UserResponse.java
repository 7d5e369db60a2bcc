package ru.tigran.nationalityengine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of the authenticated user.
 */
public record UserResponse(
        Long id,
        String username,
        String email,
        @JsonProperty("full_name") String fullName,
        boolean active
) {
}

package ru.tigran.nationalityengine.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for user login.
 */
public record LoginRequest(
    @NotBlank(message = "Username cannot be blank")
    @Schema(defaultValue = "testuser")
    String username,

    @NotBlank(message = "Password cannot be blank")
    @Schema(defaultValue = "TestPass123")
    String password
) {
}

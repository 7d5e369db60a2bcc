package ru.tigran.nationalityengine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for user registration. Email and full name are optional.
 */
public record RegisterRequest(
    @NotBlank(message = "Username cannot be blank")
    @Size(min = 3, max = 50, message = "Username must be between 3 and 50 characters")
    @Schema(defaultValue = "testuser")
    String username,

    @NotBlank(message = "Password cannot be blank")
    @Size(min = 8, max = 128, message = "Password must be between 8 and 128 characters")
    @Schema(defaultValue = "TestPass123")
    String password,

    @Email(message = "Email should be valid")
    @Size(max = 100)
    String email,

    @Size(max = 100)
    @JsonProperty("full_name")
    String fullName
) {
    public RegisterRequest(String username, String password) {
        this(username, password, null, null);
    }
}

package ru.tigran.nationalityengine.exception;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned for every failed request.
 */
public record ErrorResponse(
        @JsonProperty("error_code") String errorCode,
        String message
) {
}

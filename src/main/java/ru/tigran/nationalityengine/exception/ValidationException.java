package ru.tigran.nationalityengine.exception;

/**
 * Thrown when caller input is rejected (blank name, malformed country code, bad limit,
 * duplicate username, wrong credentials).
 * HTTP status: 400 Bad Request
 */
public class ValidationException extends ApplicationException {
    public ValidationException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ValidationException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage(), errorCode.getCode());
    }
}

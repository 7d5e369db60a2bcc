package ru.tigran.nationalityengine.exception;

/**
 * Thrown when a request reaches a protected operation without a usable identity.
 * HTTP status: 403 Forbidden
 */
public class UnauthorizedException extends ApplicationException {
    public UnauthorizedException(String message, String errorCode) {
        super(message, errorCode);
    }
}

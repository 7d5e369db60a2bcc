package ru.tigran.nationalityengine.exception;

import org.springframework.http.HttpStatus;

/**
 * Internal class used by GlobalExceptionHandler to map exception types to HTTP status codes
 * and logging levels.
 */
record ExceptionInfo(HttpStatus status, boolean shouldLogError) {

    static ExceptionInfo forException(ApplicationException exception) {
        if (exception instanceof ResourceNotFoundException) {
            return new ExceptionInfo(HttpStatus.NOT_FOUND, false);
        } else if (exception instanceof UnauthorizedException) {
            return new ExceptionInfo(HttpStatus.FORBIDDEN, false);
        } else if (exception instanceof ValidationException) {
            return new ExceptionInfo(HttpStatus.BAD_REQUEST, false);
        } else if (exception instanceof PredictionUnavailableException) {
            return new ExceptionInfo(HttpStatus.SERVICE_UNAVAILABLE, false);
        } else if (exception instanceof UpstreamUnavailableException) {
            return new ExceptionInfo(HttpStatus.SERVICE_UNAVAILABLE, true);
        } else if (exception instanceof UpstreamMalformedException) {
            return new ExceptionInfo(HttpStatus.BAD_GATEWAY, true);
        } else if (exception instanceof StoreFailureException) {
            return new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true);
        }
        // Default for unknown ApplicationException subtypes
        return new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true);
    }
}

package ru.tigran.nationalityengine.exception;

/**
 * Persistence error on the cache, country or popularity tables.
 * Fatal to the current request.
 * HTTP status: 500 Internal Server Error
 */
public class StoreFailureException extends ApplicationException {
    public StoreFailureException(String message, Throwable cause) {
        super(message, ErrorCode.STORE_FAILURE.getCode(), false, cause);
    }
}

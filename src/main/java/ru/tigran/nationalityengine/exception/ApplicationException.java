package ru.tigran.nationalityengine.exception;

/**
 * Base exception class for all application-specific exceptions.
 * Carries an error code from {@link ErrorCode} and a retriable flag.
 *
 * Retriable exceptions indicate transient conditions (upstream outage, timeout)
 * where the caller may try again later. Non-retriable ones indicate a caller error
 * or a permanent failure.
 */
public abstract class ApplicationException extends RuntimeException {
    private final String errorCode;
    private final boolean retriable;

    protected ApplicationException(String message, String errorCode) {
        this(message, errorCode, false);
    }

    protected ApplicationException(String message, String errorCode, boolean retriable) {
        super(message);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    protected ApplicationException(String message, String errorCode, boolean retriable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Returns true if this exception represents a transient error that can be retried later.
     *
     * @return true if retriable, false if permanent error
     */
    public boolean isRetriable() {
        return retriable;
    }
}

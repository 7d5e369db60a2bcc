package ru.tigran.nationalityengine.exception;

/**
 * Network error, timeout, non-success status or open circuit breaker on an upstream call.
 * Retriable.
 */
public class UpstreamUnavailableException extends UpstreamException {

    public UpstreamUnavailableException(String service, String message) {
        super(service, message, ErrorCode.UPSTREAM_UNAVAILABLE, true, null);
    }

    public UpstreamUnavailableException(String service, String message, Throwable cause) {
        super(service, message, ErrorCode.UPSTREAM_UNAVAILABLE, true, cause);
    }
}

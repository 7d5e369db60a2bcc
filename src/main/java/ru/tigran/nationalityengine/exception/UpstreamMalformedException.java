package ru.tigran.nationalityengine.exception;

/**
 * Upstream answered, but the body does not have the expected shape
 * (or the requested key does not exist there).
 */
public class UpstreamMalformedException extends UpstreamException {

    public UpstreamMalformedException(String service, String message) {
        super(service, message, ErrorCode.UPSTREAM_MALFORMED, false, null);
    }

    public UpstreamMalformedException(String service, String message, Throwable cause) {
        super(service, message, ErrorCode.UPSTREAM_MALFORMED, false, cause);
    }
}

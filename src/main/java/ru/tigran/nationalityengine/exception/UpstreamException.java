package ru.tigran.nationalityengine.exception;

/**
 * Failure of one call to an external data source (Nationalize.io or REST Countries).
 * The concrete subtype tells whether the service could not be reached or answered
 * with something that cannot be parsed.
 */
public abstract class UpstreamException extends ApplicationException {

    private final String service;

    protected UpstreamException(String service, String message, ErrorCode errorCode, boolean retriable, Throwable cause) {
        super(message, errorCode.getCode(), retriable, cause);
        this.service = service;
    }

    /**
     * Name of the upstream service that failed, e.g. "nationalize" or "restcountries".
     */
    public String getService() {
        return service;
    }
}

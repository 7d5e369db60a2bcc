package ru.tigran.nationalityengine.exception;

/**
 * No usable prediction could be produced for this request.
 * Callers should retry later, not immediately.
 * HTTP status: 503 Service Unavailable
 */
public class PredictionUnavailableException extends ApplicationException {
    public PredictionUnavailableException(String name, Throwable cause) {
        super("Nationality prediction for '" + name + "' is temporarily unavailable",
                ErrorCode.PREDICTION_UNAVAILABLE.getCode(), true, cause);
    }
}

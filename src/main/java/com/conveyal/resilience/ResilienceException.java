package com.conveyal.resilience;

import org.apache.commons.lang.exception.ExceptionUtils;

/**
 * The single error type raised by the resilience computations. The TYPE tells a batch run (or any other caller)
 * which kind of per-area failure occurred, so it can be tabulated without parsing messages.
 */
public class ResilienceException extends RuntimeException {

    public final TYPE type;

    public enum TYPE {
        BAD_CONFIG,
        BAD_DATA,
        INCOMPLETE_SERIES,
        INSUFFICIENT_BASELINE_DATA,
        UNRESOLVED_WINDOW,
        UNKNOWN;
    }

    public static ResilienceException BadConfig(String message) {
        return new ResilienceException(TYPE.BAD_CONFIG, message);
    }

    public static ResilienceException BadData(String message) {
        return new ResilienceException(TYPE.BAD_DATA, message);
    }

    public static ResilienceException IncompleteSeries(String message) {
        return new ResilienceException(TYPE.INCOMPLETE_SERIES, message);
    }

    public static ResilienceException InsufficientBaselineData(String message) {
        return new ResilienceException(TYPE.INSUFFICIENT_BASELINE_DATA, message);
    }

    public static ResilienceException UnresolvedWindow(String message) {
        return new ResilienceException(TYPE.UNRESOLVED_WINDOW, message);
    }

    public static ResilienceException Unknown(Exception e) {
        return new ResilienceException(TYPE.UNKNOWN, ExceptionUtils.getRootCauseMessage(e), e);
    }

    public ResilienceException(TYPE type, String message) {
        super(message);
        this.type = type;
    }

    public ResilienceException(TYPE type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    @Override
    public String toString() {
        return "ResilienceException{" + type + ": " + getMessage() + '}';
    }
}

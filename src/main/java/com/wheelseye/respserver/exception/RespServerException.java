package com.wheelseye.respserver.exception;

import lombok.Getter;

/**
 * Base runtime exception of the RESP server.
 *
 * Carries a machine readable error code and optional details so that
 * startup failures and protocol faults can be logged uniformly.
 */
@Getter
public class RespServerException extends RuntimeException {

    public static final String PROTOCOL_ERROR = "PROTOCOL_ERROR";
    public static final String CONFIGURATION_ERROR = "CONFIGURATION_ERROR";
    public static final String STARTUP_FAILED = "STARTUP_FAILED";

    private final String errorCode;
    private final String details;

    public RespServerException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
        this.details = null;
    }

    public RespServerException(String message, String errorCode, String details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details;
    }

    public RespServerException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = cause != null ? cause.getMessage() : null;
    }

    // Static factories for common errors

    public static RespServerException configurationError(String message) {
        return new RespServerException(message, CONFIGURATION_ERROR);
    }

    public static RespServerException startupFailed(String message, Throwable cause) {
        return new RespServerException(message, cause, STARTUP_FAILED);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{errorCode='" + errorCode + "', message='" + getMessage() + "'"
                + (details != null ? ", details='" + details + "'" : "") + "}";
    }
}

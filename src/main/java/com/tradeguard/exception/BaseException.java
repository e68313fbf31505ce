package com.tradeguard.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the engine's unchecked exception hierarchy.
 *
 * <p>Every subclass carries an {@link ErrorCode} (which fixes the HTTP status used by
 * {@link GlobalExceptionHandler}) and an optional details map that is rendered verbatim
 * into the error response and the audit entry recorded for the failure.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }
}

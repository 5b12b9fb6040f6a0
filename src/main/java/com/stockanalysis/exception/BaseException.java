package com.stockanalysis.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the application's unchecked exception hierarchy. Every failure raised by
 * this codebase carries an {@link ErrorCode} and an optional map of structured details
 * (symbol, endpoint class, retry-after) that log statements and reports can pick up.
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

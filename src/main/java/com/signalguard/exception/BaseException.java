package com.signalguard.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the service's failures. Each carries a stable {@link ErrorCode} and a small detail map
 * that ends up in ledger payloads and log lines.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    /**
     * Code written as the ledger reason when this failure ends an order attempt. Subclasses
     * that know the venue's own code append it.
     */
    public String getReasonCode() {
        return errorCode.getCode();
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }

    /** Ledger reason for any failure; failures from outside this hierarchy are INTERNAL_ERROR. */
    public static String reasonCodeOf(Throwable failure) {
        if (failure instanceof BaseException base) {
            return base.getReasonCode();
        }
        return ErrorCode.INTERNAL_ERROR.getCode();
    }
}

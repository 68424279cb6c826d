package com.signalguard.exception;

/**
 * Base type for failures reported by the exchange gateway.
 */
public abstract class ExchangeException extends BaseException {

    protected ExchangeException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    protected ExchangeException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}

package com.signalguard.exception;

/**
 * Network failure, timeout or rate-limit response. Retried with backoff by
 * {@link com.signalguard.exchange.ExchangeCallExecutor}.
 */
public class TransientExchangeException extends ExchangeException {

    public TransientExchangeException(String message) {
        super(ErrorCode.EXCHANGE_TRANSIENT, message);
    }

    public TransientExchangeException(String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_TRANSIENT, message, cause);
    }
}

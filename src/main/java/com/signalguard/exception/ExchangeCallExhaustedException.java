package com.signalguard.exception;

import java.util.Map;

public class ExchangeCallExhaustedException extends BaseException {

    public ExchangeCallExhaustedException(String operation, int attempts, Throwable cause) {
        super(
                ErrorCode.EXCHANGE_RETRIES_EXHAUSTED,
                "Exchange call " + operation + " failed after " + attempts + " attempts: " + cause.getMessage(),
                Map.of("operation", operation, "attempts", attempts),
                cause);
    }
}

package com.signalguard.exception;

import java.util.Map;

public class SignalValidationException extends BaseException {

    public SignalValidationException(String signalId, String message) {
        super(ErrorCode.VALIDATION_ERROR, message, Map.of("signalId", String.valueOf(signalId)));
    }
}

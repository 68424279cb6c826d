package com.signalguard.exception;

public class PositionNotFoundException extends BaseException {

    public PositionNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}

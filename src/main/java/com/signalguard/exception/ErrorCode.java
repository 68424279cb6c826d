package com.signalguard.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable machine-parseable error codes. {@code retryable} marks the codes the
 * exchange call executor is allowed to retry with backoff.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", false),
    NOT_FOUND("NOT_FOUND", false),
    ILLEGAL_STATE_TRANSITION("ILLEGAL_STATE_TRANSITION", false),
    EXCHANGE_TRANSIENT("EXCHANGE_TRANSIENT", true),
    EXCHANGE_REJECTED("EXCHANGE_REJECTED", false),
    EXCHANGE_RETRIES_EXHAUSTED("EXCHANGE_RETRIES_EXHAUSTED", false),
    CAPABILITY_UNKNOWN("CAPABILITY_UNKNOWN", false),
    FATAL_SAFETY_TRIGGER("FATAL_SAFETY_TRIGGER", false),
    INTERNAL_ERROR("INTERNAL_ERROR", false);

    private final String code;
    private final boolean retryable;
}

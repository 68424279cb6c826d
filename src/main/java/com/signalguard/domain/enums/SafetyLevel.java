package com.signalguard.domain.enums;

/**
 * Process-wide safety level. {@code NORMAL ⇄ SAFE_MODE → PANIC_CLOSE}; panic is left only by an operator.
 */
public enum SafetyLevel {
    NORMAL,
    SAFE_MODE,
    PANIC_CLOSE;

    public boolean allowsNewEntries() {
        return this == NORMAL;
    }
}

package com.signalguard.domain.enums;

public enum ProtectionOutcome {
    ALREADY_PROTECTED,
    TRIGGER_PLACED,
    LOCAL_GUARD_ARMED,
    NOT_ELIGIBLE,
    FAILED
}

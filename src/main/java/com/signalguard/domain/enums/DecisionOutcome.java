package com.signalguard.domain.enums;

public enum DecisionOutcome {
    ACCEPTED,
    REJECTED,
    PENDING_CONFIRMATION
}

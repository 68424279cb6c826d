package com.signalguard.domain.enums;

public enum LedgerEntryType {
    SIGNAL_RECEIVED,
    SIGNAL_DECISION,
    MANAGE_ACTION,
    ORDER_ATTEMPT,
    ORDER_RESULT,
    FILL,
    PROTECTION,
    FALLBACK,
    RECONCILIATION,
    SAFETY_TRANSITION
}

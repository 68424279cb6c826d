package com.signalguard.domain.enums;

/**
 * Category of an operator alert. Selects the message template.
 */
public enum AlertType {
    SIGNAL_REJECTED,
    PENDING_CONFIRMATION,
    POSITION,
    PROTECTION_FAILURE,
    FALLBACK,
    SAFETY,
    RECONCILIATION,
    ANOMALY
}

package com.signalguard.domain.enums;

/** Outcome of submitting a signal at the core boundary. */
public enum IntakeStatus {
    DUPLICATE,
    EDIT_IGNORED,
    INVALID,
    RECORDED,
    REJECTED,
    PENDING_CONFIRMATION,
    OPENED,
    MANAGED
}

package com.signalguard.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a managed position, from accepted plan to closed exposure.
 *
 * <pre>
 * PENDING_ENTRY → PARTIALLY_FILLED → FILLED_PROTECTED → (MANAGING) → CLOSING → CLOSED
 * </pre>
 *
 * <p>REJECTED, PENDING_CONFIRMATION and PENDING_MANUAL hold plans that never reached the exchange.
 */
public enum LifecycleState {
    PENDING_CONFIRMATION,
    PENDING_MANUAL,
    PENDING_ENTRY,
    PARTIALLY_FILLED,
    FILLED_PROTECTED,
    MANAGING,
    CLOSING,
    CLOSED,
    REJECTED;

    /** True while the position may carry exchange exposure. */
    public boolean isOpen() {
        return this == PENDING_ENTRY
                || this == PARTIALLY_FILLED
                || this == FILLED_PROTECTED
                || this == MANAGING
                || this == CLOSING;
    }

    public boolean isTerminal() {
        return this == CLOSED || this == REJECTED;
    }

    public boolean canTransitionTo(LifecycleState target) {
        return allowedTargets().contains(target);
    }

    private Set<LifecycleState> allowedTargets() {
        return switch (this) {
            case PENDING_CONFIRMATION, PENDING_MANUAL -> EnumSet.of(PENDING_ENTRY, REJECTED);
            case PENDING_ENTRY -> EnumSet.of(PARTIALLY_FILLED, FILLED_PROTECTED, CLOSING, CLOSED, REJECTED);
            case PARTIALLY_FILLED -> EnumSet.of(PARTIALLY_FILLED, FILLED_PROTECTED, CLOSING, CLOSED);
            case FILLED_PROTECTED -> EnumSet.of(MANAGING, CLOSING, CLOSED);
            case MANAGING -> EnumSet.of(MANAGING, FILLED_PROTECTED, CLOSING, CLOSED);
            case CLOSING -> EnumSet.of(CLOSED);
            case CLOSED, REJECTED -> EnumSet.noneOf(LifecycleState.class);
        };
    }
}

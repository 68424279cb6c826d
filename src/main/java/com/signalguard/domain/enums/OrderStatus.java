package com.signalguard.domain.enums;

public enum OrderStatus {
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isActive() {
        return this == OPEN || this == PARTIALLY_FILLED;
    }
}

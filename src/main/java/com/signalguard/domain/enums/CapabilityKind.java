package com.signalguard.domain.enums;

public enum CapabilityKind {

    /** Exchange accepts native trigger/plan orders for this account. */
    PLAN_ORDERS
}

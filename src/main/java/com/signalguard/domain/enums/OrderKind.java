package com.signalguard.domain.enums;

/** Exchange order kinds. TRIGGER is a native conditional (plan) order. */
public enum OrderKind {
    MARKET,
    LIMIT,
    TRIGGER
}

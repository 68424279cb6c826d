package com.signalguard.domain.enums;

/** Which point of a signal's entry range a LIMIT entry is placed at. */
public enum LimitPriceStrategy {
    MID,
    LOW,
    HIGH
}

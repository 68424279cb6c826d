package com.signalguard.domain.enums;

/** What to do with a value above its configured cap: clamp it or reject the signal. */
public enum OverLimitPolicy {
    CAP,
    REJECT
}

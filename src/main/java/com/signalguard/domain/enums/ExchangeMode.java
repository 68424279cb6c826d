package com.signalguard.domain.enums;

/** Which exchange adapter backs the gateway. */
public enum ExchangeMode {
    PAPER,
    LIVE
}

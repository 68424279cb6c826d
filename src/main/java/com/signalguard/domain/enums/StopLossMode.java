package com.signalguard.domain.enums;

/**
 * Stop-loss enforcement mode.
 */
public enum StopLossMode {

    /** Native exchange-side conditional order. */
    TRIGGER,

    /** Locally monitored synthetic stop, closed with a market order when the price crosses. */
    LOCAL_GUARD
}

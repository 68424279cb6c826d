package com.signalguard.domain.enums;

/**
 * Direction of a position. Also used as the hold-side on hedge-mode accounts.
 */
public enum Side {
    LONG,
    SHORT;

    /** Order side that opens or adds to a position on this side. */
    public OrderSide entrySide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    /** Order side that reduces or closes a position on this side: sell for long, buy for short. */
    public OrderSide closeSide() {
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }
}

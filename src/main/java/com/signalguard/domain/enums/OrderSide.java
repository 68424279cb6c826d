package com.signalguard.domain.enums;

/** Buy or sell side of an exchange order. */
public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}

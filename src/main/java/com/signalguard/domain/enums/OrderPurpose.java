package com.signalguard.domain.enums;

/** What an order is for. Carried on every order so reconciliation can classify open orders. */
public enum OrderPurpose {
    ENTRY,
    STOP_LOSS,
    TAKE_PROFIT,
    REDUCE,
    BREAK_EVEN_REDUCE,
    CLOSE
}

package com.signalguard.event;

/**
 * Classifies the lifecycle change that triggered a {@link PositionEvent}.
 */
public enum PositionEventType {

    /** Entry order accepted by the exchange. */
    OPENED,

    /** Entry fill progressed (partial or complete). */
    FILLED,

    /** Protective stop placed, replaced or armed. */
    PROTECTED,

    /** Stop moved to break-even. */
    BREAK_EVEN_MOVED,

    /** Position size reduced by a partial take-profit or manage action. */
    REDUCED,

    /** Position fully closed. */
    CLOSED,

    /** Close order left exposure on the exchange; the position stays CLOSING. */
    CLOSE_INCOMPLETE,

    /** Entry refused by the exchange or by a lifecycle guard. */
    REJECTED,

    /** Protective stop could not be placed after bounded retries. */
    PROTECTION_FAILED
}

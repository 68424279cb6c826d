package com.signalguard.domain.enums;

/**
 * Recorded degradations. Each is ledgered and sent to the notification sink.
 */
public enum FallbackType {

    /** Trigger-mode stop replaced by a local guard because plan orders are unsupported or unconfirmed. */
    PLAN_ORDER_FALLBACK,

    /** Price feed dropped from streaming to polling. */
    PRICE_FEED_FALLBACK,

    /** Local guard armed for a position. */
    LOCAL_GUARD_ARMED
}

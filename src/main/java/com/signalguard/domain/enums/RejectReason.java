package com.signalguard.domain.enums;

/**
 * Policy-level rejection codes emitted by the risk engine and lifecycle manager.
 * The enum name is the stable, machine-parseable code written to the ledger.
 */
public enum RejectReason {
    SAFETY_GATE,
    STALE_SIGNAL,
    SYMBOL_BLACKLISTED,
    SYMBOL_NOT_ALLOWED,
    SYMBOL_NOT_TRADABLE,
    INSUFFICIENT_LIQUIDITY,
    SIDE_NOT_ALLOWED,
    LOW_QUALITY,
    COOLDOWN_ACTIVE,
    STOPLOSS_BREAKER_ACTIVE,
    LEVERAGE_EXCEEDS_CAP,
    INVALID_STOP_LOSS,
    MISSING_STOP_LOSS,
    STOP_LOSS_UNAVAILABLE,
    INVALID_MARKET_PRICE,
    ENTRY_SLIPPAGE,
    MAX_OPEN_POSITIONS,
    SIZE_BELOW_MINIMUM,
    NOTIONAL_EXCEEDS_CAP,
    DUPLICATE_POSITION,
    EXCHANGE_REJECTED,
    INVALID_SIGNAL
}

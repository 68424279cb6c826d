package com.signalguard.domain.enums;

/**
 * Position mode of the exchange account.
 *
 * <p>ONE_WAY closes and reduces through a reduce-only flag. HEDGE closes through an explicit
 * close trade-side keyed by the position's hold-side.
 */
public enum AccountMode {
    ONE_WAY,
    HEDGE
}

package com.signalguard.domain.enums;

/**
 * Closed set of signal variants accepted at the ingestion boundary.
 */
public enum SignalKind {

    /** Opens a new position. Requires symbol, side, entry type and entry range. */
    ENTRY_SIGNAL,

    /** Manages an existing position (reduce, break-even move, take-profit update). */
    MANAGE_ACTION,

    /** Recognised message with nothing executable. Recorded only. */
    NON_SIGNAL
}

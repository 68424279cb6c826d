package com.signalguard.domain.enums;

/**
 * Classification of divergences between local managed positions and exchange truth.
 */
public enum MismatchType {

    /** Open position without a live stop order, armed guard, or with a pending replace left behind. */
    MISSING_PROTECTION,

    /** Stop order sized for a different quantity than the live position. */
    PROTECTION_SIZE_MISMATCH,

    /** Entry fill on the exchange ahead of the local filled quantity. */
    ENTRY_FILL_PROGRESS,

    /** Local open position with no exchange position (stopped out or closed by hand). */
    CLOSED_EXTERNALLY,

    /** Exchange position with no local record. */
    ORPHAN_POSITION,

    /** More than one active local record for the same symbol. */
    DUPLICATE_LOCAL,

    /** CLOSING position whose close left exposure on the exchange. */
    CLOSE_INCOMPLETE,

    /** Provisional local guard while native trigger orders are now confirmed supported. */
    PROVISIONAL_GUARD_UPGRADE
}

package com.signalguard.domain.enums;

/** Explicit open/close instruction used by hedge-mode accounts. */
public enum TradeSide {
    OPEN,
    CLOSE
}

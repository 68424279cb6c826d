package com.signalguard.domain.enums;

/** Where a price tick came from. Local-guard correctness depends on STREAM freshness. */
public enum PriceSource {
    STREAM,
    POLL
}

package com.signalguard.domain.enums;

public enum EntryType {
    MARKET,
    LIMIT
}

package com.signalguard.domain.enums;

public enum SymbolPolicy {
    ALLOWLIST,
    ALLOW_ALL
}

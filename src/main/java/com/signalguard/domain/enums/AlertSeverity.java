package com.signalguard.domain.enums;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}

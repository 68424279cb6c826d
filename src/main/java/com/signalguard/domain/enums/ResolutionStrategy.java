package com.signalguard.domain.enums;

public enum ResolutionStrategy {
    AUTO_REPAIR,
    ALERT_ONLY,
    ADOPT
}

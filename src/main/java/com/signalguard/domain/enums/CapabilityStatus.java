package com.signalguard.domain.enums;

/**
 * Tri-state capability probe result. UNKNOWN means the probe was inconclusive
 * (timeout, network failure) and is never read as UNSUPPORTED.
 */
public enum CapabilityStatus {
    SUPPORTED,
    UNSUPPORTED,
    UNKNOWN
}

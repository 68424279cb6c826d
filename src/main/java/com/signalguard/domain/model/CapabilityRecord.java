package com.signalguard.domain.model;

import com.signalguard.domain.enums.CapabilityKind;
import com.signalguard.domain.enums.CapabilityStatus;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Cached capability probe result. A record past {@code expiresAt} must be re-probed
 * before a trigger-mode decision relies on it.
 */
@Value
@Builder
public class CapabilityRecord {

    CapabilityKind kind;
    CapabilityStatus status;
    Instant probedAt;
    Instant expiresAt;
    String detail;

    public boolean isFresh(Instant now) {
        return now.isBefore(expiresAt);
    }
}

package com.signalguard.domain.model;

import com.signalguard.domain.enums.CapabilityKind;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Read-only view for a health/readiness reporting layer. */
@Value
@Builder
public class ReadinessSnapshot {

    boolean ready;
    SafetySnapshot safety;
    int openPositionCount;
    Map<CapabilityKind, CapabilityRecord> capabilities;
    Map<String, PriceTick> prices;
    int localGuardCount;

    @Builder.Default
    List<String> degradations = List.of();
}

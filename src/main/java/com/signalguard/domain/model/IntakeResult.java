package com.signalguard.domain.model;

import com.signalguard.domain.enums.IntakeStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IntakeResult {

    IntakeStatus status;
    String signalId;
    RiskDecision decision;
    String positionId;
    String detail;
}

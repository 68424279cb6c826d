package com.signalguard.domain.model;

import com.signalguard.domain.enums.SafetyLevel;
import com.signalguard.domain.enums.SafetyTrigger;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Recorded change of safety level. Replaying the history reproduces the current snapshot. */
@Value
@Builder
public class SafetyTransition {

    SafetyLevel from;
    SafetyLevel to;
    SafetyTrigger trigger;
    String reason;
    Instant at;
    long version;
}

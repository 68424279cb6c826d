package com.signalguard.domain.model;

import com.signalguard.domain.enums.ProtectionOutcome;
import com.signalguard.domain.enums.StopLossMode;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProtectionResult {

    ProtectionOutcome outcome;
    StopLossMode mode;
    String orderId;
    BigDecimal stopPrice;
    BigDecimal quantity;
    String message;

    public static ProtectionResult notEligible(String message) {
        return ProtectionResult.builder()
                .outcome(ProtectionOutcome.NOT_ELIGIBLE)
                .message(message)
                .build();
    }

    public static ProtectionResult failed(String message) {
        return ProtectionResult.builder()
                .outcome(ProtectionOutcome.FAILED)
                .message(message)
                .build();
    }

    public boolean isProtected() {
        return outcome == ProtectionOutcome.ALREADY_PROTECTED
                || outcome == ProtectionOutcome.TRIGGER_PLACED
                || outcome == ProtectionOutcome.LOCAL_GUARD_ARMED;
    }
}

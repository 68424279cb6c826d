package com.signalguard.domain.model;

import com.signalguard.domain.enums.StopLossMode;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StopLossSpec {

    BigDecimal triggerPrice;

    /** Configured mode; the lifecycle manager may still fall back to LOCAL_GUARD. */
    StopLossMode mode;

    /** True when the price came from the default stop distance rather than the signal. */
    boolean derived;
}

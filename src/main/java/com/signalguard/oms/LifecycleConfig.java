package com.signalguard.oms;

import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Order lifecycle settings: protective order placement, break-even moves and local guards.
 */
@Data
@Component
@ConfigurationProperties(prefix = "signalguard.lifecycle")
public class LifecycleConfig {

    /** Placement attempts for one protective stop before escalating. */
    private int maxSubmitRetries = 3;

    private long retryDelayMs = 200;

    /** Existing stop is kept while |stopQty - positionQty| / positionQty stays at or below this. */
    private BigDecimal sizeTolerance = new BigDecimal("0.2");

    /** Confirm a new stop appears among open orders before clearing the pending marker. */
    private boolean verifyPlacement = true;

    /** Profit (as a ratio of entry) required before the stop may move to break-even. */
    private BigDecimal breakEvenTriggerPct = new BigDecimal("0.01");

    /** Break-even stop sits this far past entry in the profitable direction. */
    private BigDecimal breakEvenBufferPct = new BigDecimal("0.001");

    /** Readiness is degraded while a local guard runs on a polled price feed. */
    private boolean requireStreamingForLocalGuard = true;

    private long localGuardIntervalMs = 1_000;

    /** Place a reduce-only order at the average entry once the first two entry legs have filled. */
    private boolean breakEvenReduceOnTwoEntries = false;

    /** Share of the filled size, in percent, that the break-even reduce order closes. */
    private BigDecimal breakEvenReducePct = new BigDecimal("50");

    /** Whether a re-edited source message may be executed as a new signal. */
    private boolean executeEditedSignals = false;
}

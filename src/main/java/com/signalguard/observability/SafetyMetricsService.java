package com.signalguard.observability;

import com.signalguard.event.FallbackEvent;
import com.signalguard.event.ReconciliationEvent;
import com.signalguard.event.SafetyStateChangedEvent;
import com.signalguard.event.SignalDecisionEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the risk gate, exchange call discipline and safety state.
 *
 * <ul>
 *   <li><b>signals.decisions</b> (counter, tags outcome/reason)</li>
 *   <li><b>exchange.calls</b> (timer, tags operation/result)</li>
 *   <li><b>fallbacks</b> (counter, tag type)</li>
 *   <li><b>reconciliation.mismatches</b> and <b>reconciliation.repairs</b> (counters)</li>
 *   <li><b>safety.level</b> (gauge: 0 NORMAL, 1 SAFE_MODE, 2 PANIC_CLOSE)</li>
 * </ul>
 */
@Service
public class SafetyMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter reconciliationMismatchCounter;
    private final Counter reconciliationRepairCounter;
    private final AtomicInteger safetyLevel = new AtomicInteger(0);

    public SafetyMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.reconciliationMismatchCounter = Counter.builder("reconciliation.mismatches")
                .description("Divergences found between local and exchange state")
                .register(meterRegistry);

        this.reconciliationRepairCounter = Counter.builder("reconciliation.repairs")
                .description("Automatic repairs applied by reconciliation")
                .register(meterRegistry);

        meterRegistry.gauge("safety.level", safetyLevel);
    }

    public void recordExchangeCall(String operation, long elapsedNanos, boolean success) {
        Timer.builder("exchange.calls")
                .description("Exchange call latency including retries")
                .tag("operation", operation)
                .tag("result", success ? "success" : "failure")
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    @EventListener
    @Order(20)
    public void onSignalDecision(SignalDecisionEvent event) {
        Counter.builder("signals.decisions")
                .tag("outcome", event.getDecision().getOutcome().name())
                .tag("reason", event.getDecision().getReasonCode())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onFallback(FallbackEvent event) {
        Counter.builder("fallbacks")
                .tag("type", event.getFallbackType().name())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onReconciliation(ReconciliationEvent event) {
        int mismatches = event.getResult().getTotalMismatches();
        if (mismatches > 0) {
            reconciliationMismatchCounter.increment(mismatches);
        }
        if (event.getResult().getRepairsApplied() > 0) {
            reconciliationRepairCounter.increment(event.getResult().getRepairsApplied());
        }
    }

    @EventListener
    @Order(20)
    public void onSafetyStateChanged(SafetyStateChangedEvent event) {
        safetyLevel.set(event.getSnapshot().getLevel().ordinal());
    }

    // Expose for testing
    int getSafetyLevel() {
        return safetyLevel.get();
    }

    Counter getReconciliationMismatchCounter() {
        return reconciliationMismatchCounter;
    }
}

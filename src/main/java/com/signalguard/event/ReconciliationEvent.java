package com.signalguard.event;

import com.signalguard.domain.model.ReconciliationResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every reconciliation pass, scheduled or manual.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>NotificationService: alerts when mismatches needed operator attention</li>
 *   <li>SafetyMetricsService: counts mismatches and repairs</li>
 * </ul>
 */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationResult result;
    private final boolean manual;

    public ReconciliationEvent(Object source, ReconciliationResult result, boolean manual) {
        super(source);
        this.result = result;
        this.manual = manual;
    }

    public ReconciliationResult getResult() {
        return result;
    }

    /** True if triggered by an operator call, false if triggered by the scheduler. */
    public boolean isManual() {
        return manual;
    }
}

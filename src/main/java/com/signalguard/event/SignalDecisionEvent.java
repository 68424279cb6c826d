package com.signalguard.event;

import com.signalguard.domain.model.RiskDecision;
import com.signalguard.domain.model.SignalIntent;
import org.springframework.context.ApplicationEvent;

/**
 * Published for every risk decision on an entry signal. PENDING_CONFIRMATION decisions are
 * notify-only: the notification sink forwards them to the operator.
 */
public class SignalDecisionEvent extends ApplicationEvent {

    private final SignalIntent signal;
    private final RiskDecision decision;

    public SignalDecisionEvent(Object source, SignalIntent signal, RiskDecision decision) {
        super(source);
        this.signal = signal;
        this.decision = decision;
    }

    public SignalIntent getSignal() {
        return signal;
    }

    public RiskDecision getDecision() {
        return decision;
    }
}

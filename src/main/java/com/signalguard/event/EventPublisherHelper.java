package com.signalguard.event;

import com.signalguard.domain.enums.AlertSeverity;
import com.signalguard.domain.enums.FallbackType;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.ReconciliationResult;
import com.signalguard.domain.model.RiskDecision;
import com.signalguard.domain.model.SafetySnapshot;
import com.signalguard.domain.model.SafetyTransition;
import com.signalguard.domain.model.SignalIntent;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed wrapper around Spring's {@link ApplicationEventPublisher} for all SignalGuard events.
 *
 * <p>All methods are non-blocking for the caller as far as the core is concerned: the
 * notification sink listens asynchronously, so a slow delivery never delays a decision.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Signal ----

    public void publishDecision(Object source, SignalIntent signal, RiskDecision decision) {
        applicationEventPublisher.publishEvent(new SignalDecisionEvent(source, signal, decision));
    }

    // ---- Position ----

    public void publishPosition(Object source, ManagedPosition position, PositionEventType type, String message) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position, type, message));
    }

    // ---- Fallback ----

    public void publishFallback(
            Object source, FallbackType type, String symbol, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new FallbackEvent(source, type, symbol, message, details));
    }

    // ---- Safety ----

    public void publishSafetyChange(Object source, SafetyTransition transition, SafetySnapshot snapshot) {
        applicationEventPublisher.publishEvent(new SafetyStateChangedEvent(source, transition, snapshot));
    }

    // ---- Reconciliation ----

    public void publishReconciliation(Object source, ReconciliationResult result, boolean manual) {
        applicationEventPublisher.publishEvent(new ReconciliationEvent(source, result, manual));
    }

    public void publishAnomaly(
            Object source,
            String code,
            AlertSeverity severity,
            String symbol,
            String message,
            Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new AnomalyEvent(source, code, severity, symbol, message, details));
    }
}

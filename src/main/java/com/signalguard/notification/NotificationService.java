package com.signalguard.notification;

import com.signalguard.domain.enums.AlertSeverity;
import com.signalguard.domain.enums.AlertType;
import com.signalguard.domain.enums.DecisionOutcome;
import com.signalguard.domain.enums.SafetyLevel;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.OrderPlan;
import com.signalguard.domain.model.PositionMismatch;
import com.signalguard.domain.model.ReconciliationResult;
import com.signalguard.domain.model.RiskDecision;
import com.signalguard.domain.model.SafetyTransition;
import com.signalguard.event.AnomalyEvent;
import com.signalguard.event.FallbackEvent;
import com.signalguard.event.PositionEvent;
import com.signalguard.event.ReconciliationEvent;
import com.signalguard.event.SafetyStateChangedEvent;
import com.signalguard.event.SignalDecisionEvent;
import java.time.Clock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Notification sink. Turns decision, fallback, safety, reconciliation and anomaly events into
 * {@link Alert}s and hands them to Telegram.
 *
 * <p>Every listener runs on {@code eventExecutor}. A failed delivery is logged and never reaches
 * the publisher, so a Telegram outage cannot delay an order or a stop placement.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final TelegramNotifier telegramNotifier;
    private final NotificationTemplateEngine notificationTemplateEngine;
    private final Clock clock;

    public NotificationService(
            TelegramNotifier telegramNotifier, NotificationTemplateEngine notificationTemplateEngine, Clock clock) {
        this.telegramNotifier = telegramNotifier;
        this.notificationTemplateEngine = notificationTemplateEngine;
        this.clock = clock;
    }

    public void notify(Alert alert) {
        try {
            String text = notificationTemplateEngine.render(alert);
            telegramNotifier.send(text, alert.getSeverity());
        } catch (RuntimeException e) {
            log.error("Failed to deliver {} alert '{}': {}", alert.getType(), alert.getTitle(), e.getMessage());
        }
    }

    @Async("eventExecutor")
    @EventListener
    @Order(15)
    public void onSignalDecision(SignalDecisionEvent event) {
        RiskDecision decision = event.getDecision();
        if (decision.getOutcome() == DecisionOutcome.PENDING_CONFIRMATION) {
            OrderPlan plan = decision.getPlan();
            notify(alert(
                    AlertType.PENDING_CONFIRMATION,
                    AlertSeverity.INFO,
                    "Pending confirmation",
                    plan != null ? plan.getSymbol() : event.getSignal().getSymbol(),
                    describePlan(plan, decision.getDetail())));
        } else if (decision.isRejected()) {
            notify(alert(
                    AlertType.SIGNAL_REJECTED,
                    AlertSeverity.WARNING,
                    decision.getReasonCode(),
                    event.getSignal().getSymbol(),
                    "Signal " + event.getSignal().getSignalId() + " rejected: " + decision.getReasonCode()
                            + (decision.getDetail() != null ? " (" + decision.getDetail() + ")" : "")));
        }
    }

    @Async("eventExecutor")
    @EventListener
    @Order(15)
    public void onFallback(FallbackEvent event) {
        notify(alert(
                AlertType.FALLBACK,
                AlertSeverity.WARNING,
                event.getFallbackType().name(),
                event.getSymbol(),
                event.getFallbackType() + ": " + event.getMessage()));
    }

    @Async("eventExecutor")
    @EventListener
    @Order(15)
    public void onSafetyStateChanged(SafetyStateChangedEvent event) {
        SafetyTransition transition = event.getTransition();
        AlertSeverity severity = switch (transition.getTo()) {
            case PANIC_CLOSE -> AlertSeverity.CRITICAL;
            case SAFE_MODE -> AlertSeverity.WARNING;
            case NORMAL -> AlertSeverity.INFO;
        };
        String message = transition.getFrom() + " -> " + transition.getTo() + " (" + transition.getTrigger() + ")\n"
                + transition.getReason();
        if (transition.getTo() != SafetyLevel.NORMAL) {
            message += "\nNew entries are blocked.";
        }
        notify(alert(AlertType.SAFETY, severity, transition.getTo().name(), null, message));
    }

    @Async("eventExecutor")
    @EventListener
    @Order(15)
    public void onPositionEvent(PositionEvent event) {
        ManagedPosition position = event.getPosition();
        switch (event.getEventType()) {
            case PROTECTION_FAILED -> notify(alert(
                    AlertType.PROTECTION_FAILURE,
                    AlertSeverity.CRITICAL,
                    "Protection failed",
                    position.getSymbol(),
                    position.getSide() + " " + position.getFilledQuantity() + ": " + event.getMessage()));
            case CLOSE_INCOMPLETE -> notify(alert(
                    AlertType.POSITION,
                    AlertSeverity.CRITICAL,
                    "CLOSE INCOMPLETE",
                    position.getSymbol(),
                    event.getMessage()));
            case CLOSED -> notify(alert(
                    AlertType.POSITION,
                    AlertSeverity.INFO,
                    "POSITION CLOSED",
                    position.getSymbol(),
                    position.getSide() + " closed: " + position.getCloseReason()));
            default -> {
                // lifecycle progress is visible in the ledger
            }
        }
    }

    @Async("eventExecutor")
    @EventListener
    @Order(15)
    public void onReconciliation(ReconciliationEvent event) {
        ReconciliationResult result = event.getResult();
        if (!result.hasMismatches() && !result.isAborted()) {
            return;
        }
        String lines = result.getMismatches().stream()
                .map(NotificationService::describeMismatch)
                .collect(Collectors.joining("\n"));
        String message = (result.isAborted() ? "Pass aborted.\n" : "")
                + result.getTotalMismatches() + " mismatch(es), " + result.getRepairsApplied() + " repaired, "
                + result.getRepairFailures() + " failed"
                + (lines.isEmpty() ? "" : "\n" + lines);
        AlertSeverity severity = result.getRepairFailures() > 0 || result.getAlertsRaised() > 0
                ? AlertSeverity.WARNING
                : AlertSeverity.INFO;
        notify(alert(AlertType.RECONCILIATION, severity, "Reconciliation", null, message));
    }

    @Async("eventExecutor")
    @EventListener
    @Order(15)
    public void onAnomaly(AnomalyEvent event) {
        notify(alert(AlertType.ANOMALY, event.getSeverity(), event.getCode(), event.getSymbol(), event.getMessage()));
    }

    private Alert alert(AlertType type, AlertSeverity severity, String title, String symbol, String message) {
        return Alert.builder()
                .type(type)
                .severity(severity)
                .title(title)
                .symbol(symbol)
                .message(message)
                .timestamp(clock.instant())
                .build();
    }

    private static String describePlan(OrderPlan plan, String detail) {
        if (plan == null) {
            return detail;
        }
        return plan.getSide() + " " + plan.getQuantity() + " @ " + plan.getEntryPrice()
                + (plan.getStopLoss() != null ? ", stop " + plan.getStopLoss().getTriggerPrice() : "")
                + ", risk " + plan.getRiskAmount()
                + "\nplan " + plan.getPlanId()
                + (detail != null ? "\n" + detail : "");
    }

    private static String describeMismatch(PositionMismatch mismatch) {
        return mismatch.getType() + " " + mismatch.getSymbol() + " -> " + mismatch.getResolution()
                + (mismatch.isResolved() ? " (resolved)" : "");
    }
}

package com.signalguard.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.signalguard.domain.enums.AlertSeverity;
import com.signalguard.domain.enums.AlertType;
import com.signalguard.domain.enums.MismatchType;
import com.signalguard.domain.enums.RejectReason;
import com.signalguard.domain.enums.ResolutionStrategy;
import com.signalguard.domain.enums.SafetyLevel;
import com.signalguard.domain.enums.SafetyTrigger;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.enums.SignalKind;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.PositionMismatch;
import com.signalguard.domain.model.ReconciliationResult;
import com.signalguard.domain.model.RiskDecision;
import com.signalguard.domain.model.SafetySnapshot;
import com.signalguard.domain.model.SafetyTransition;
import com.signalguard.domain.model.SignalIntent;
import com.signalguard.event.AnomalyEvent;
import com.signalguard.event.PositionEvent;
import com.signalguard.event.PositionEventType;
import com.signalguard.event.ReconciliationEvent;
import com.signalguard.event.SafetyStateChangedEvent;
import com.signalguard.event.SignalDecisionEvent;
import com.signalguard.notification.Alert;
import com.signalguard.notification.NotificationService;
import com.signalguard.notification.NotificationTemplateEngine;
import com.signalguard.notification.TelegramNotifier;
import com.signalguard.unit.support.MutableClock;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

/**
 * Unit tests for NotificationService: event-to-alert conversion, severity per event and
 * isolation of delivery failures.
 */
class NotificationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private TelegramNotifier telegramNotifier;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        notificationService = new NotificationService(telegramNotifier, new NotificationTemplateEngine(), new MutableClock(NOW));
    }

    private String sentText(AlertSeverity severity) {
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(telegramNotifier).send(text.capture(), eq(severity));
        return text.getValue();
    }

    private static SignalIntent entrySignal() {
        return SignalIntent.builder()
                .signalId("sig-1")
                .kind(SignalKind.ENTRY_SIGNAL)
                .symbol("BTCUSDT")
                .side(Side.LONG)
                .build();
    }

    @Test
    void rejectedSignal_sendsWarningWithReason() {
        RiskDecision decision = RiskDecision.rejected(RejectReason.INVALID_STOP_LOSS, "stop 12% away");

        notificationService.onSignalDecision(new SignalDecisionEvent(this, entrySignal(), decision));

        String text = sentText(AlertSeverity.WARNING);
        assertThat(text).contains("<b>SIGNAL REJECTED</b>").contains("INVALID_STOP_LOSS").contains("BTCUSDT");
    }

    @Test
    void acceptedSignal_sendsNothing() {
        RiskDecision decision = RiskDecision.accepted(null);

        notificationService.onSignalDecision(new SignalDecisionEvent(this, entrySignal(), decision));

        verify(telegramNotifier, never()).send(anyString(), any());
    }

    @Test
    void panicTransition_isCritical() {
        SafetyTransition transition = SafetyTransition.builder()
                .from(SafetyLevel.NORMAL)
                .to(SafetyLevel.PANIC_CLOSE)
                .trigger(SafetyTrigger.KILL_SWITCH)
                .reason("kill switch file says PANIC")
                .at(NOW)
                .version(1)
                .build();

        notificationService.onSafetyStateChanged(
                new SafetyStateChangedEvent(this, transition, SafetySnapshot.initial(NOW)));

        String text = sentText(AlertSeverity.CRITICAL);
        assertThat(text).contains("SAFETY PANIC_CLOSE").contains("New entries are blocked.");
    }

    @Test
    void protectionFailure_isCritical() {
        ManagedPosition position = ManagedPosition.builder()
                .positionId("p-1")
                .symbol("BTCUSDT")
                .side(Side.LONG)
                .filledQuantity(new BigDecimal("1.0"))
                .build();

        notificationService.onPositionEvent(
                new PositionEvent(this, position, PositionEventType.PROTECTION_FAILED, "stop rejected twice"));

        assertThat(sentText(AlertSeverity.CRITICAL))
                .contains("<b>PROTECTION FAILURE</b>")
                .contains("<b>Action:</b>");
    }

    @Test
    void lifecycleProgress_isNotSent() {
        ManagedPosition position = ManagedPosition.builder().positionId("p-1").symbol("BTCUSDT").build();

        notificationService.onPositionEvent(new PositionEvent(this, position, PositionEventType.PROTECTED, "stop placed"));

        verify(telegramNotifier, never()).send(anyString(), any());
    }

    @Test
    void cleanReconciliation_isNotSent() {
        ReconciliationResult result = ReconciliationResult.builder().timestamp(NOW).trigger("SCHEDULED").build();

        notificationService.onReconciliation(new ReconciliationEvent(this, result, false));

        verify(telegramNotifier, never()).send(anyString(), any());
    }

    @Test
    void reconciliationWithAlerts_listsMismatches() {
        ReconciliationResult result = ReconciliationResult.builder().timestamp(NOW).trigger("MANUAL").build();
        result.getMismatches().add(PositionMismatch.builder()
                .symbol("ETHUSDT")
                .type(MismatchType.ORPHAN_POSITION)
                .resolution(ResolutionStrategy.ALERT_ONLY)
                .build());
        result.setAlertsRaised(1);

        notificationService.onReconciliation(new ReconciliationEvent(this, result, true));

        assertThat(sentText(AlertSeverity.WARNING)).contains("ORPHAN_POSITION ETHUSDT -&gt; ALERT_ONLY");
    }

    @Test
    void anomaly_keepsEventSeverity() {
        notificationService.onAnomaly(new AnomalyEvent(
                this, "LIQUIDATION_DISTANCE", AlertSeverity.CRITICAL, "BTCUSDT", "liq 99 vs mark 100", Map.of()));

        assertThat(sentText(AlertSeverity.CRITICAL)).contains("LIQUIDATION_DISTANCE");
    }

    @Test
    void deliveryFailure_doesNotPropagate() {
        doThrow(new IllegalStateException("bot api down")).when(telegramNotifier).send(anyString(), any());
        Alert alert = Alert.builder()
                .type(AlertType.ANOMALY)
                .severity(AlertSeverity.WARNING)
                .title("TEST")
                .message("test")
                .timestamp(NOW)
                .build();

        notificationService.notify(alert);

        verify(telegramNotifier).send(anyString(), eq(AlertSeverity.WARNING));
    }
}

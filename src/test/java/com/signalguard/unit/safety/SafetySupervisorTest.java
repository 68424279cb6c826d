package com.signalguard.unit.safety;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.signalguard.domain.enums.KillSwitchAction;
import com.signalguard.domain.enums.SafetyLevel;
import com.signalguard.domain.enums.SafetyTrigger;
import com.signalguard.domain.model.AccountSnapshot;
import com.signalguard.domain.model.PanicSweepResult;
import com.signalguard.domain.model.SafetySnapshot;
import com.signalguard.event.EventPublisherHelper;
import com.signalguard.exchange.AccountStateService;
import com.signalguard.exchange.ExchangeCallExecutor;
import com.signalguard.safety.KillSwitchReader;
import com.signalguard.safety.PanicCloseSweeper;
import com.signalguard.safety.SafetyConfig;
import com.signalguard.safety.SafetySupervisor;
import com.signalguard.service.LedgerService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Unit tests for SafetySupervisor: transitions, sticky panic, kill-switch auto-clear and the
 * drawdown, margin and API error triggers.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SafetySupervisorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private KillSwitchReader killSwitchReader;

    @Mock
    private PanicCloseSweeper panicCloseSweeper;

    @Mock
    private AccountStateService accountStateService;

    @Mock
    private ExchangeCallExecutor exchangeCallExecutor;

    @Mock
    private LedgerService ledgerService;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private SafetyConfig safetyConfig;
    private SafetySupervisor safetySupervisor;

    @BeforeEach
    void setUp() {
        safetyConfig = new SafetyConfig();
        safetySupervisor = new SafetySupervisor(
                killSwitchReader,
                panicCloseSweeper,
                accountStateService,
                exchangeCallExecutor,
                ledgerService,
                eventPublisherHelper,
                safetyConfig,
                Clock.fixed(NOW, ZoneOffset.UTC));

        when(killSwitchReader.read()).thenReturn(KillSwitchAction.NONE);
        when(panicCloseSweeper.sweep(anyString())).thenReturn(PanicSweepResult.builder().success(true).build());
    }

    private static AccountSnapshot account(String equity, String marginUsed) {
        return AccountSnapshot.builder()
                .equity(new BigDecimal(equity))
                .available(new BigDecimal(equity))
                .marginUsed(new BigDecimal(marginUsed))
                .capturedAt(NOW)
                .build();
    }

    // ========================
    // TRANSITIONS
    // ========================

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        void startsNormal() {
            SafetySnapshot snapshot = safetySupervisor.current();

            assertThat(snapshot.getLevel()).isEqualTo(SafetyLevel.NORMAL);
            assertThat(snapshot.allowsNewEntries()).isTrue();
            assertThat(safetySupervisor.history()).isEmpty();
        }

        @Test
        @DisplayName("Findings merge their triggers within SAFE_MODE")
        void triggersMerge() {
            safetySupervisor.reportFinding(SafetyTrigger.PROTECTION_FAILURE, "stop failed");
            SafetySnapshot snapshot = safetySupervisor.reportFinding(SafetyTrigger.RECONCILIATION, "mismatch");

            assertThat(snapshot.getLevel()).isEqualTo(SafetyLevel.SAFE_MODE);
            assertThat(snapshot.getTriggers())
                    .containsExactlyInAnyOrder(SafetyTrigger.PROTECTION_FAILURE, SafetyTrigger.RECONCILIATION);
            assertThat(snapshot.getVersion()).isEqualTo(2);
            assertThat(safetySupervisor.history()).hasSize(2);
        }

        @Test
        @DisplayName("Repeating the same trigger records nothing new")
        void repeatIsNoOp() {
            safetySupervisor.reportFinding(SafetyTrigger.PROTECTION_FAILURE, "stop failed");
            safetySupervisor.reportFinding(SafetyTrigger.PROTECTION_FAILURE, "stop failed again");

            verify(ledgerService, times(1)).recordSafetyTransition(any());
            verify(eventPublisherHelper, times(1)).publishSafetyChange(any(), any(), any());
        }

        @Test
        @DisplayName("PANIC_CLOSE runs the sweep and ignores later SAFE_MODE findings")
        void panicIsSticky() {
            safetySupervisor.enterPanic(SafetyTrigger.OPERATOR, "operator panic");
            SafetySnapshot after = safetySupervisor.reportFinding(SafetyTrigger.DRAWDOWN, "drawdown");

            assertThat(after.getLevel()).isEqualTo(SafetyLevel.PANIC_CLOSE);
            assertThat(safetySupervisor.isPanic()).isTrue();
            verify(panicCloseSweeper).sweep("operator panic");
        }

        @Test
        @DisplayName("Operator clear leaves panic, resets peak equity and re-arms the sweep")
        void clearToNormal() {
            when(accountStateService.cached()).thenReturn(account("900", "0"));
            safetySupervisor.enterPanic(SafetyTrigger.OPERATOR, "operator panic");

            SafetySnapshot snapshot = safetySupervisor.clearToNormal("alice");

            assertThat(snapshot.getLevel()).isEqualTo(SafetyLevel.NORMAL);
            assertThat(snapshot.getTriggers()).isEmpty();
            assertThat(safetySupervisor.getPeakEquity()).isEqualByComparingTo("900");
            verify(panicCloseSweeper).reset();
        }
    }

    // ========================
    // KILL SWITCH
    // ========================

    @Nested
    @DisplayName("Kill switch")
    class KillSwitch {

        @Test
        @DisplayName("SAFE_MODE from the switch alone clears when the switch is removed")
        void autoClears() {
            when(killSwitchReader.read()).thenReturn(KillSwitchAction.SAFE_MODE);
            safetySupervisor.evaluate();
            assertThat(safetySupervisor.current().getLevel()).isEqualTo(SafetyLevel.SAFE_MODE);

            when(killSwitchReader.read()).thenReturn(KillSwitchAction.NONE);
            safetySupervisor.evaluate();

            assertThat(safetySupervisor.current().getLevel()).isEqualTo(SafetyLevel.NORMAL);
        }

        @Test
        @DisplayName("SAFE_MODE with another trigger stays after the switch is removed")
        void staysWithOtherTrigger() {
            when(killSwitchReader.read()).thenReturn(KillSwitchAction.SAFE_MODE);
            safetySupervisor.evaluate();
            safetySupervisor.reportFinding(SafetyTrigger.PROTECTION_FAILURE, "stop failed");

            when(killSwitchReader.read()).thenReturn(KillSwitchAction.NONE);
            safetySupervisor.evaluate();

            assertThat(safetySupervisor.current().getLevel()).isEqualTo(SafetyLevel.SAFE_MODE);
        }

        @Test
        @DisplayName("PANIC_CLOSE from the switch sweeps once and persists after removal")
        void panicFromSwitch() {
            when(killSwitchReader.read()).thenReturn(KillSwitchAction.PANIC_CLOSE);
            safetySupervisor.evaluate();
            safetySupervisor.evaluate();

            when(killSwitchReader.read()).thenReturn(KillSwitchAction.NONE);
            safetySupervisor.evaluate();

            assertThat(safetySupervisor.isPanic()).isTrue();
            verify(panicCloseSweeper, times(1)).sweep(anyString());
        }

        @Test
        @DisplayName("Unreadable switch leaves the state unchanged")
        void readFailure() {
            when(killSwitchReader.read()).thenThrow(new IllegalStateException("io"));

            safetySupervisor.evaluate();

            assertThat(safetySupervisor.current().getLevel()).isEqualTo(SafetyLevel.NORMAL);
        }
    }

    // ========================
    // ACCOUNT TRIGGERS
    // ========================

    @Nested
    @DisplayName("Account triggers")
    class AccountTriggers {

        @Test
        @DisplayName("Drawdown beyond the limit from peak equity enters SAFE_MODE(DRAWDOWN)")
        void drawdown() {
            when(accountStateService.cached()).thenReturn(account("1000", "0"));
            safetySupervisor.evaluate();
            when(accountStateService.cached()).thenReturn(account("800", "0"));

            safetySupervisor.evaluate();

            assertThat(safetySupervisor.current().getLevel()).isEqualTo(SafetyLevel.SAFE_MODE);
            assertThat(safetySupervisor.current().getTriggers()).containsExactly(SafetyTrigger.DRAWDOWN);
            assertThat(safetySupervisor.getPeakEquity()).isEqualByComparingTo("1000");
        }

        @Test
        @DisplayName("Drawdown within the limit keeps NORMAL")
        void drawdownWithinLimit() {
            when(accountStateService.cached()).thenReturn(account("1000", "0"));
            safetySupervisor.evaluate();
            when(accountStateService.cached()).thenReturn(account("900", "0"));

            safetySupervisor.evaluate();

            assertThat(safetySupervisor.current().getLevel()).isEqualTo(SafetyLevel.NORMAL);
        }

        @Test
        @DisplayName("Margin usage above the ratio enters SAFE_MODE(MARGIN_USAGE)")
        void marginUsage() {
            when(accountStateService.cached()).thenReturn(account("1000", "850"));

            safetySupervisor.evaluate();

            assertThat(safetySupervisor.current().getTriggers()).containsExactly(SafetyTrigger.MARGIN_USAGE);
        }

        @Test
        @DisplayName("Burst of failed exchange calls enters SAFE_MODE(API_ERROR_BURST)")
        void apiErrorBurst() {
            when(exchangeCallExecutor.failuresWithin(any())).thenReturn(safetyConfig.getApiErrorBurst());

            safetySupervisor.evaluate();

            assertThat(safetySupervisor.current().getTriggers()).containsExactly(SafetyTrigger.API_ERROR_BURST);
        }

        @Test
        @DisplayName("No cached account skips the account checks")
        void noAccount() {
            safetySupervisor.evaluate();

            assertThat(safetySupervisor.current().getLevel()).isEqualTo(SafetyLevel.NORMAL);
            verify(ledgerService, never()).recordSafetyTransition(any());
        }
    }
}

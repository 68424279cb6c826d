package com.signalguard.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.signalguard.domain.enums.CapabilityKind;
import com.signalguard.domain.enums.CapabilityStatus;
import com.signalguard.domain.enums.EntryType;
import com.signalguard.domain.enums.FallbackType;
import com.signalguard.domain.enums.LifecycleState;
import com.signalguard.domain.enums.OrderPurpose;
import com.signalguard.domain.enums.ProtectionOutcome;
import com.signalguard.domain.enums.SafetyTrigger;
import com.signalguard.domain.enums.StopLossMode;
import com.signalguard.domain.model.ExchangeOrder;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.ProtectionResult;
import com.signalguard.oms.StopLossManager;
import com.signalguard.unit.support.PaperHarness;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for StopLossManager: mode selection from the plan-order capability, keeping acceptable
 * stops, fallback to local guards and escalation after failed placement.
 */
class StopLossManagerTest {

    private static final String SYMBOL = PaperHarness.SYMBOL;

    private PaperHarness harness;
    private StopLossManager stopLossManager;

    @BeforeEach
    void setUp() {
        harness = new PaperHarness();
        stopLossManager = harness.stopLossManager;
    }

    private List<ExchangeOrder> stopOrders(PaperHarness h) {
        return h.paper.getOpenOrders().stream()
                .filter(o -> o.getPurpose() == OrderPurpose.STOP_LOSS)
                .toList();
    }

    // ========================
    // EXISTING STOP
    // ========================

    @Nested
    @DisplayName("Existing stop")
    class ExistingStop {

        @Test
        @DisplayName("Stop within size tolerance at the wanted price is kept without new orders")
        void acceptableStopKept() {
            ManagedPosition position =
                    harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
            String stopId = position.getStopOrderId();

            ProtectionResult result =
                    stopLossManager.ensureProtection(position, new BigDecimal("98"), new BigDecimal("0.9"));

            assertThat(result.getOutcome()).isEqualTo(ProtectionOutcome.ALREADY_PROTECTED);
            assertThat(result.getOrderId()).isEqualTo(stopId);
            assertThat(stopOrders(harness)).singleElement()
                    .satisfies(o -> assertThat(o.getOrderId()).isEqualTo(stopId));
        }

        @Test
        @DisplayName("Stop at a different trigger price is replaced, never duplicated")
        void differentPriceReplaced() {
            ManagedPosition position =
                    harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
            String stopId = position.getStopOrderId();

            ProtectionResult result =
                    stopLossManager.ensureProtection(position, new BigDecimal("97"), new BigDecimal("1.0"));

            assertThat(result.getOutcome()).isEqualTo(ProtectionOutcome.TRIGGER_PLACED);
            assertThat(position.getStopOrderId()).isNotEqualTo(stopId);
            assertThat(position.isProtectionPending()).isFalse();
            assertThat(stopOrders(harness)).singleElement()
                    .satisfies(o -> assertThat(o.getTriggerPrice()).isEqualByComparingTo("97"));
        }

        @Test
        @DisplayName("Failed lookup of the existing stop replaces it instead of escaping the caller")
        void lookupFailureReplacesStop() {
            ManagedPosition position =
                    harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
            String stopId = position.getStopOrderId();
            // both gated tries of the open-order lookup
            harness.paper.failNextCalls(2);

            ProtectionResult result =
                    stopLossManager.ensureProtection(position, new BigDecimal("98"), new BigDecimal("1.0"));

            assertThat(result.isProtected()).isTrue();
            assertThat(position.isProtectionPending()).isFalse();
            assertThat(stopOrders(harness)).singleElement()
                    .satisfies(o -> assertThat(o.getOrderId()).isNotEqualTo(stopId));
        }

        @Test
        @DisplayName("Nothing to protect without a filled quantity")
        void noQuantity() {
            ManagedPosition position =
                    harness.orderLifecycleManager.open(harness.plan(EntryType.LIMIT, "1.0", "99"));

            ProtectionResult result = stopLossManager.ensureProtection(position, new BigDecimal("98"), BigDecimal.ZERO);

            assertThat(result.getOutcome()).isEqualTo(ProtectionOutcome.NOT_ELIGIBLE);
            assertThat(stopOrders(harness)).isEmpty();
        }

        @Test
        @DisplayName("Size tolerance is relative to the position size")
        void sizeTolerance() {
            BigDecimal tolerance = new BigDecimal("0.2");

            assertThat(StopLossManager.sizeWithinTolerance(new BigDecimal("0.8"), BigDecimal.ONE, tolerance)).isTrue();
            assertThat(StopLossManager.sizeWithinTolerance(new BigDecimal("0.6"), BigDecimal.ONE, tolerance)).isFalse();
            assertThat(StopLossManager.sizeWithinTolerance(null, BigDecimal.ONE, tolerance)).isFalse();
            assertThat(StopLossManager.sizeWithinTolerance(BigDecimal.ONE, BigDecimal.ZERO, tolerance)).isFalse();
        }
    }

    // ========================
    // FALLBACK
    // ========================

    @Nested
    @DisplayName("Local guard fallback")
    class Fallback {

        @Test
        @DisplayName("Unsupported plan orders arm a local guard and record the fallback")
        void unsupportedFallsBack() {
            harness.paper.setPlanOrdersSupported(false);

            ManagedPosition position =
                    harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));

            assertThat(position.getState()).isEqualTo(LifecycleState.FILLED_PROTECTED);
            assertThat(position.isLocalGuardArmed()).isTrue();
            assertThat(position.isProvisionalGuard()).isFalse();
            assertThat(position.getStopMode()).isEqualTo(StopLossMode.LOCAL_GUARD);
            assertThat(stopOrders(harness)).isEmpty();
            verify(harness.ledgerService)
                    .recordFallback(eq(FallbackType.PLAN_ORDER_FALLBACK), eq(SYMBOL), eq(position.getPositionId()), anyString());
        }

        @Test
        @DisplayName("Configured LOCAL_GUARD is honoured without a capability fallback record")
        void configuredLocalGuard() {
            harness.riskPolicyConfig.setStopLossMode(StopLossMode.LOCAL_GUARD);

            ManagedPosition position =
                    harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));

            assertThat(position.isLocalGuardArmed()).isTrue();
            assertThat(stopOrders(harness)).isEmpty();
            verify(harness.ledgerService, never())
                    .recordFallback(eq(FallbackType.PLAN_ORDER_FALLBACK), any(), any(), any());
        }

        @Test
        @DisplayName("Startup fallback is lifted once a later probe answers SUPPORTED")
        void sessionFallbackLifted() {
            harness.paper.setPlanOrdersSupported(false);
            harness.capabilityService.probeAtStartup(CapabilityKind.PLAN_ORDERS);

            assertThat(stopLossManager.resolveMode().mode()).isEqualTo(StopLossMode.LOCAL_GUARD);
            assertThat(stopLossManager.resolveMode().fallback()).isTrue();
            verify(harness.ledgerService)
                    .recordFallback(eq(FallbackType.PLAN_ORDER_FALLBACK), isNull(), isNull(), anyString());

            harness.paper.setPlanOrdersSupported(true);
            harness.capabilityService.probe(CapabilityKind.PLAN_ORDERS);

            assertThat(harness.capabilityService.isSessionFallback()).isFalse();
            assertThat(stopLossManager.resolveMode().mode()).isEqualTo(StopLossMode.TRIGGER);
        }
    }

    // ========================
    // UNKNOWN CAPABILITY
    // ========================

    @Nested
    @DisplayName("Capability probe timeout")
    class ProbeTimeout {

        private ExecutorService ioPool;
        private PaperHarness slow;

        @BeforeEach
        void setUp() {
            ioPool = Executors.newCachedThreadPool();
            slow = new PaperHarness(ioPool, 50);
            slow.paper.setProbeDelayMs(300);
        }

        @AfterEach
        void tearDown() {
            ioPool.shutdownNow();
        }

        @Test
        @DisplayName("Timed-out probe is UNKNOWN, never UNSUPPORTED, and arms a provisional guard")
        void timeoutIsUnknown() {
            ManagedPosition position =
                    slow.orderLifecycleManager.open(slow.plan(EntryType.MARKET, "1.0", "100"));

            assertThat(slow.capabilityService.current(CapabilityKind.PLAN_ORDERS).getStatus())
                    .isEqualTo(CapabilityStatus.UNKNOWN);
            assertThat(position.isLocalGuardArmed()).isTrue();
            assertThat(position.isProvisionalGuard()).isTrue();
            assertThat(stopOrders(slow)).isEmpty();
        }

        @Test
        @DisplayName("Provisional guard is upgraded to a trigger stop once the capability is confirmed")
        void upgradeAfterConfirmation() {
            ManagedPosition position =
                    slow.orderLifecycleManager.open(slow.plan(EntryType.MARKET, "1.0", "100"));
            slow.paper.setProbeDelayMs(0);
            slow.clock.advance(Duration.ofSeconds(slow.exchangeConfig.getCapability().getUnknownTtlSeconds() + 1));

            ProtectionResult result = slow.stopLossManager.ensureProtection(
                    position, position.getStopPrice(), position.getFilledQuantity());

            assertThat(result.getOutcome()).isEqualTo(ProtectionOutcome.TRIGGER_PLACED);
            assertThat(position.isLocalGuardArmed()).isFalse();
            assertThat(position.isProvisionalGuard()).isFalse();
            assertThat(stopOrders(slow)).hasSize(1);
        }
    }

    // ========================
    // ESCALATION
    // ========================

    @Nested
    @DisplayName("Escalation")
    class Escalation {

        @Test
        @DisplayName("Exhausted stop placement arms an emergency guard and reports a protection failure")
        void exhaustedPlacement() {
            harness.capabilityService.probe(CapabilityKind.PLAN_ORDERS);
            ManagedPosition position =
                    harness.orderLifecycleManager.open(harness.plan(EntryType.LIMIT, "1.0", "99"));
            harness.paper.fillPartially(position.getEntryOrderId(), new BigDecimal("1.0"));
            // 3 submit attempts, 2 gated tries each
            harness.paper.failNextCalls(6);

            ManagedPosition filled = harness.orderLifecycleManager.onEntryFill(
                    position.getPositionId(), new BigDecimal("1.0"), new BigDecimal("99"));

            assertThat(filled.isLocalGuardArmed()).isTrue();
            assertThat(filled.getStopMissingSince()).isEqualTo(PaperHarness.START);
            assertThat(filled.getProtectionFailures()).isEqualTo(1);
            assertThat(filled.isProtectionPending()).isFalse();
            assertThat(stopOrders(harness)).isEmpty();
            verify(harness.safetySupervisor).reportFinding(eq(SafetyTrigger.PROTECTION_FAILURE), anyString());
        }

        @Test
        @DisplayName("Stop that never shows up in the listing is cancelled before the emergency guard takes over")
        void unverifiedStopCancelled() {
            harness.paper.setListingLag(true);

            ManagedPosition position =
                    harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
            harness.paper.setListingLag(false);

            assertThat(position.isLocalGuardArmed()).isTrue();
            assertThat(position.getStopOrderId()).isNull();
            assertThat(stopOrders(harness)).isEmpty();
            verify(harness.safetySupervisor).reportFinding(eq(SafetyTrigger.PROTECTION_FAILURE), anyString());
        }
    }
}

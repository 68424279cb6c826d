package com.signalguard.unit.safety;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.signalguard.domain.enums.EntryType;
import com.signalguard.domain.enums.LifecycleState;
import com.signalguard.domain.enums.OrderPurpose;
import com.signalguard.domain.enums.SafetyTrigger;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.enums.StopLossMode;
import com.signalguard.domain.model.ExchangePosition;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.oms.LifecycleConfig;
import com.signalguard.safety.PositionInvariantMonitor;
import com.signalguard.safety.SafetyConfig;
import com.signalguard.unit.support.PaperHarness;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for PositionInvariantMonitor: liquidation distance, stop-must-exist with its deadline,
 * and the degraded feed report.
 */
class PositionInvariantMonitorTest {

    private static final String SYMBOL = PaperHarness.SYMBOL;

    private PaperHarness harness;
    private SafetyConfig safetyConfig;
    private PositionInvariantMonitor positionInvariantMonitor;

    @BeforeEach
    void setUp() {
        harness = new PaperHarness();
        safetyConfig = new SafetyConfig();
        positionInvariantMonitor = new PositionInvariantMonitor(
                harness.paper,
                harness.executor,
                harness.repository,
                harness.lockRegistry,
                harness.stopLossManager,
                harness.protectiveCloser,
                harness.priceFeedService,
                harness.safetySupervisor,
                harness.ledgerService,
                harness.eventPublisherHelper,
                safetyConfig,
                harness.lifecycleConfig,
                harness.clock);
    }

    private long stopOrderCount() {
        return harness.paper.getOpenOrders().stream()
                .filter(o -> o.getPurpose() == OrderPurpose.STOP_LOSS)
                .count();
    }

    // ========================
    // LIQUIDATION DISTANCE
    // ========================

    @Nested
    @DisplayName("Liquidation distance")
    class LiquidationDistance {

        @Test
        void distanceThreshold() {
            BigDecimal max = new BigDecimal("0.02");

            assertThat(PositionInvariantMonitor.isLiquidationTooClose(new BigDecimal("98"), new BigDecimal("100"), max)).isTrue();
            assertThat(PositionInvariantMonitor.isLiquidationTooClose(new BigDecimal("97.9"), new BigDecimal("100"), max)).isFalse();
            assertThat(PositionInvariantMonitor.isLiquidationTooClose(new BigDecimal("101.5"), new BigDecimal("100"), max)).isTrue();
            assertThat(PositionInvariantMonitor.isLiquidationTooClose(null, new BigDecimal("100"), max)).isFalse();
        }

        @Test
        @DisplayName("Tracked position within the liquidation distance is closed")
        void closesTrackedPosition() {
            ManagedPosition position = harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
            ExchangePosition exchangePosition = ExchangePosition.builder()
                    .symbol(SYMBOL)
                    .side(Side.LONG)
                    .size(BigDecimal.ONE)
                    .entryPrice(new BigDecimal("100"))
                    .markPrice(new BigDecimal("100"))
                    .liquidationPrice(new BigDecimal("99"))
                    .build();

            boolean closed = positionInvariantMonitor.checkLiquidationDistance(exchangePosition);

            assertThat(closed).isTrue();
            assertThat(position.getState()).isEqualTo(LifecycleState.CLOSED);
            assertThat(harness.paper.getPositions()).isEmpty();
        }

        @Test
        @DisplayName("Untracked exposure within the distance is closed on the exchange")
        void closesUntrackedExposure() {
            harness.paper.seedPosition(SYMBOL, Side.SHORT, new BigDecimal("0.3"), new BigDecimal("100"));
            ExchangePosition exchangePosition = ExchangePosition.builder()
                    .symbol(SYMBOL)
                    .side(Side.SHORT)
                    .size(new BigDecimal("0.3"))
                    .markPrice(new BigDecimal("100"))
                    .liquidationPrice(new BigDecimal("101"))
                    .build();

            assertThat(positionInvariantMonitor.checkLiquidationDistance(exchangePosition)).isTrue();
            assertThat(harness.paper.getPositions()).isEmpty();
        }
    }

    // ========================
    // STOP MUST EXIST
    // ========================

    @Nested
    @DisplayName("Stop must exist")
    class StopMustExist {

        @Test
        @DisplayName("Missing stop is repaired")
        void repairsMissingStop() {
            ManagedPosition position = harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
            harness.paper.cancelOrder(SYMBOL, position.getStopOrderId());
            position.setStopOrderId(null);

            boolean closed = positionInvariantMonitor.checkStopExists(position);

            assertThat(closed).isFalse();
            assertThat(position.isProtected()).isTrue();
            assertThat(stopOrderCount()).isEqualTo(1);
            verify(harness.ledgerService).recordProtection(eq(position), eq("STOP_MISSING"), anyString());
        }

        @Test
        @DisplayName("Stop still missing past the deadline closes the position and reports a protection failure")
        void deadlineCloses() {
            ManagedPosition position = harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
            harness.paper.cancelOrder(SYMBOL, position.getStopOrderId());
            position.setStopOrderId(null);
            position.setStopMissingSince(PaperHarness.START);
            harness.paper.setPlanOrdersSupported(false);
            harness.clock.advance(Duration.ofSeconds(safetyConfig.getMaxTimeWithoutStopSeconds() + 1));

            boolean closed = positionInvariantMonitor.checkStopExists(position);

            assertThat(closed).isTrue();
            assertThat(position.getState()).isEqualTo(LifecycleState.CLOSED);
            assertThat(harness.paper.getPositions()).isEmpty();
            verify(harness.safetySupervisor, atLeastOnce())
                    .reportFinding(eq(SafetyTrigger.PROTECTION_FAILURE), anyString());
        }

        @Test
        @DisplayName("Protected position is left alone")
        void protectedUntouched() {
            ManagedPosition position = harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));

            assertThat(positionInvariantMonitor.checkStopExists(position)).isFalse();
            verify(harness.ledgerService, never()).recordProtection(eq(position), eq("STOP_MISSING"), anyString());
        }
    }

    // ========================
    // SCHEDULED PASS
    // ========================

    @Nested
    @DisplayName("Scheduled pass")
    class ScheduledPass {

        @Test
        @DisplayName("Local guard on a polled feed is reported as FEED_DEGRADED when configured")
        void feedDegraded() {
            safetyConfig.setSafeModeOnFeedDegraded(true);
            harness.riskPolicyConfig.setStopLossMode(StopLossMode.LOCAL_GUARD);
            harness.paper.setStreaming(false);
            harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
            harness.priceFeedService.refresh(SYMBOL);

            positionInvariantMonitor.check();

            verify(harness.safetySupervisor).reportFinding(eq(SafetyTrigger.FEED_DEGRADED), anyString());
        }

        @Test
        @DisplayName("Nothing is checked during a panic close")
        void idleDuringPanic() {
            when(harness.safetySupervisor.isPanic()).thenReturn(true);
            ManagedPosition position = harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
            harness.paper.cancelOrder(SYMBOL, position.getStopOrderId());
            position.setStopOrderId(null);

            positionInvariantMonitor.check();

            assertThat(stopOrderCount()).isZero();
        }
    }
}

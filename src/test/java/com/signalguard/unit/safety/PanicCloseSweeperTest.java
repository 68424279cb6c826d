package com.signalguard.unit.safety;

import static org.assertj.core.api.Assertions.assertThat;

import com.signalguard.domain.enums.EntryType;
import com.signalguard.domain.enums.LifecycleState;
import com.signalguard.domain.enums.OrderKind;
import com.signalguard.domain.enums.OrderPurpose;
import com.signalguard.domain.enums.OrderSide;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.model.ExchangeOrder;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.PanicSweepResult;
import com.signalguard.safety.PanicCloseSweeper;
import com.signalguard.safety.SafetyConfig;
import com.signalguard.unit.support.PaperHarness;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for PanicCloseSweeper flattening the paper account. */
class PanicCloseSweeperTest {

    private PaperHarness harness;
    private PanicCloseSweeper panicCloseSweeper;

    @BeforeEach
    void setUp() {
        harness = new PaperHarness();
        harness.paper.setPrice("ETHUSDT", new BigDecimal("2000"));
        panicCloseSweeper = new PanicCloseSweeper(
                harness.paper,
                harness.executor,
                harness.protectiveCloser,
                harness.repository,
                harness.ledgerService,
                harness.eventPublisherHelper,
                new SafetyConfig());
    }

    @Test
    @DisplayName("Sweep cancels entries, closes tracked and untracked positions and marks local state CLOSED")
    void flattensAccount() {
        ManagedPosition tracked = harness.orderLifecycleManager.open(
                harness.plan(EntryType.MARKET, "1.0", "100", "105"));
        harness.paper.seedPosition("ETHUSDT", Side.SHORT, new BigDecimal("0.5"), new BigDecimal("2000"));
        harness.paper.seedOrder(ExchangeOrder.builder()
                .symbol("ETHUSDT")
                .side(OrderSide.SELL)
                .kind(OrderKind.LIMIT)
                .quantity(new BigDecimal("0.2"))
                .price(new BigDecimal("2100"))
                .purpose(OrderPurpose.ENTRY)
                .build());

        PanicSweepResult result = panicCloseSweeper.sweep("test panic");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getPositionsClosed()).isEqualTo(2);
        // the stop and take-profit go with the closed position, only the entry is cancelled up front
        assertThat(result.getOrdersCancelled()).isEqualTo(1);
        assertThat(harness.paper.getPositions()).isEmpty();
        assertThat(harness.paper.getOpenOrders()).isEmpty();
        assertThat(tracked.getState()).isEqualTo(LifecycleState.CLOSED);
        assertThat(tracked.getCloseReason()).isEqualTo("panic close: test panic");
    }

    @Test
    @DisplayName("Local position with no exchange exposure is closed locally")
    void closesPendingEntries() {
        ManagedPosition pending = harness.orderLifecycleManager.open(harness.plan(EntryType.LIMIT, "1.0", "99"));

        panicCloseSweeper.sweep("test panic");

        assertThat(pending.getState()).isEqualTo(LifecycleState.CLOSED);
        assertThat(harness.paper.getOpenOrders()).isEmpty();
    }

    @Test
    @DisplayName("Refused close leaves the stop in place and is reported")
    void refusedCloseKeepsStop() {
        ManagedPosition tracked = harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
        String stopId = tracked.getStopOrderId();
        harness.paper.setRejectClosingMarketOrders(true);

        PanicSweepResult result = panicCloseSweeper.sweep("test panic");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrors()).anySatisfy(e -> assertThat(e).startsWith("close LONG " + PaperHarness.SYMBOL));
        assertThat(harness.paper.getPositions()).singleElement()
                .satisfies(p -> assertThat(p.getSize()).isEqualByComparingTo("1.0"));
        assertThat(harness.paper.getOpenOrders())
                .anySatisfy(o -> assertThat(o.getOrderId()).isEqualTo(stopId));
        assertThat(tracked.getState()).isEqualTo(LifecycleState.CLOSING);
        assertThat(tracked.getStopOrderId()).isEqualTo(stopId);
    }

    @Test
    @DisplayName("Sweep runs once until reset")
    void runsOnce() {
        panicCloseSweeper.sweep("first");

        PanicSweepResult second = panicCloseSweeper.sweep("second");

        assertThat(second.isAlreadyRan()).isTrue();
        assertThat(panicCloseSweeper.hasRun()).isTrue();

        panicCloseSweeper.reset();
        assertThat(panicCloseSweeper.sweep("third").isAlreadyRan()).isFalse();
    }

    @Test
    @DisplayName("Exchange failures are collected, not thrown")
    void collectsErrors() {
        harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
        harness.paper.failNextCalls(2);

        PanicSweepResult result = panicCloseSweeper.sweep("test panic");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrors()).anySatisfy(e -> assertThat(e).startsWith("list open orders"));
        assertThat(harness.paper.getPositions()).isEmpty();
    }
}

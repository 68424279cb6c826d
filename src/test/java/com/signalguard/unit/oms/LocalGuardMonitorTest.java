package com.signalguard.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.signalguard.domain.enums.EntryType;
import com.signalguard.domain.enums.LifecycleState;
import com.signalguard.domain.enums.StopLossMode;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.oms.LocalGuardMonitor;
import com.signalguard.unit.support.PaperHarness;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for LocalGuardMonitor firing synthetic stops on the paper exchange. */
class LocalGuardMonitorTest {

    private static final String SYMBOL = PaperHarness.SYMBOL;

    private PaperHarness harness;
    private LocalGuardMonitor localGuardMonitor;

    @BeforeEach
    void setUp() {
        harness = new PaperHarness();
        harness.riskPolicyConfig.setStopLossMode(StopLossMode.LOCAL_GUARD);
        localGuardMonitor = new LocalGuardMonitor(harness.repository, harness.priceFeedService, harness.protectiveCloser);
    }

    @Test
    @DisplayName("Guard fires when the price reaches the stop and closes the position")
    void guardFires() {
        ManagedPosition position = harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
        harness.paper.setPrice(SYMBOL, new BigDecimal("97.9"));
        harness.priceFeedService.refresh(SYMBOL);

        boolean fired = localGuardMonitor.checkPosition(position);

        assertThat(fired).isTrue();
        assertThat(position.getState()).isEqualTo(LifecycleState.CLOSED);
        assertThat(position.isLocalGuardArmed()).isFalse();
        assertThat(harness.paper.getPositions()).isEmpty();
        assertThat(harness.cooldownTracker.getConsecutiveStopLosses()).isEqualTo(1);
    }

    @Test
    @DisplayName("Guard holds while the price stays above a long stop")
    void guardHolds() {
        ManagedPosition position = harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));
        harness.paper.setPrice(SYMBOL, new BigDecimal("98.5"));
        harness.priceFeedService.refresh(SYMBOL);

        assertThat(localGuardMonitor.checkPosition(position)).isFalse();
        assertThat(position.getState()).isEqualTo(LifecycleState.FILLED_PROTECTED);
        assertThat(localGuardMonitor.armedPositions()).containsExactly(position);
    }

    @Test
    @DisplayName("Scheduled pass skips positions protected by a trigger stop")
    void triggerStopsIgnored() {
        harness.riskPolicyConfig.setStopLossMode(StopLossMode.TRIGGER);
        harness.orderLifecycleManager.open(harness.plan(EntryType.MARKET, "1.0", "100"));

        assertThat(localGuardMonitor.armedPositions()).isEmpty();
    }
}

package com.signalguard.domain.model;

import com.signalguard.domain.enums.LifecycleState;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.enums.StopLossMode;
import com.signalguard.exception.IllegalLifecycleTransitionException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Locally managed position: the lifecycle manager's view of one plan's exposure.
 *
 * <p>Stored in Redis as the hot copy; every change is also ledgered. Protection is held either
 * as a native trigger order ({@code stopOrderId}) or as an armed local guard. While
 * {@code protectionPending} is set a cancel-then-replace is in flight; reconciliation treats a
 * pending marker that outlived its process as a protection gap.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManagedPosition {

    private String positionId;
    private String planId;
    private String signalId;
    private String symbol;
    private Side side;

    /** Quantity the plan asked for. */
    private BigDecimal intendedQuantity;

    /** Quantity actually filled on the exchange; the stop is sized to this. */
    @Builder.Default
    private BigDecimal filledQuantity = BigDecimal.ZERO;

    private BigDecimal averageEntry;
    private BigDecimal plannedEntryPrice;
    private int leverage;

    private String entryOrderId;

    /** Resting limit orders for the entry legs after the first, when the entry is split. */
    @Builder.Default
    private List<String> scaleInOrderIds = new ArrayList<>();

    /** Filled size at which the first two entry legs are complete; null for a single entry. */
    private BigDecimal breakEvenReduceAt;

    private String breakEvenReduceOrderId;

    // ---- Protection ----

    private StopLossMode stopMode;
    private String stopOrderId;
    private BigDecimal stopPrice;
    private BigDecimal stopQuantity;
    private boolean localGuardArmed;

    /** Local guard armed while the plan-order capability was unconfirmed; upgraded once supported. */
    private boolean provisionalGuard;

    private boolean protectionPending;
    private boolean breakEvenApplied;
    private Instant stopMissingSince;
    private int protectionFailures;

    // ---- Take profit ----

    @Builder.Default
    private List<TakeProfitLevel> takeProfits = new ArrayList<>();

    @Builder.Default
    private List<String> takeProfitOrderIds = new ArrayList<>();

    // ---- Lifecycle ----

    private LifecycleState state;
    private String closeReason;
    private Instant openedAt;
    private Instant updatedAt;
    private Instant closedAt;

    /** Kept local copy of the plan until the entry is placed (pending confirmation). */
    private OrderPlanSnapshot pendingPlan;

    public boolean isOpen() {
        return state != null && state.isOpen();
    }

    /** Active stop reference exists and no replace is in flight. */
    public boolean isProtected() {
        return !protectionPending && (stopOrderId != null || localGuardArmed);
    }

    /**
     * Moves to {@code target} if the lifecycle allows it.
     *
     * @throws IllegalLifecycleTransitionException when the edge is not legal
     */
    public void transitionTo(LifecycleState target, Instant at) {
        if (state == target) {
            updatedAt = at;
            return;
        }
        if (state == null || !state.canTransitionTo(target)) {
            throw new IllegalLifecycleTransitionException(positionId, state, target);
        }
        state = target;
        updatedAt = at;
        if (target == LifecycleState.CLOSED) {
            closedAt = at;
        }
    }

    public boolean hasExposure() {
        return filledQuantity != null && filledQuantity.signum() > 0;
    }
}

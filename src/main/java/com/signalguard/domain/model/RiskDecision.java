package com.signalguard.domain.model;

import com.signalguard.domain.enums.DecisionOutcome;
import com.signalguard.domain.enums.RejectReason;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of a risk evaluation: an accepted plan, a typed rejection, or a plan held for
 * operator confirmation.
 */
@Getter
@Builder
@ToString
public class RiskDecision {

    private final DecisionOutcome outcome;
    private final OrderPlan plan;
    private final RejectReason reason;
    private final String detail;

    public static RiskDecision accepted(OrderPlan plan) {
        return RiskDecision.builder()
                .outcome(DecisionOutcome.ACCEPTED)
                .plan(plan)
                .build();
    }

    public static RiskDecision rejected(RejectReason reason, String detail) {
        return RiskDecision.builder()
                .outcome(DecisionOutcome.REJECTED)
                .reason(reason)
                .detail(detail)
                .build();
    }

    public static RiskDecision pendingConfirmation(OrderPlan plan, String detail) {
        return RiskDecision.builder()
                .outcome(DecisionOutcome.PENDING_CONFIRMATION)
                .plan(plan)
                .detail(detail)
                .build();
    }

    public boolean isAccepted() {
        return outcome == DecisionOutcome.ACCEPTED;
    }

    public boolean isRejected() {
        return outcome == DecisionOutcome.REJECTED;
    }

    /** Stable code for the ledger: the reject reason, or the outcome name otherwise. */
    public String getReasonCode() {
        return reason != null ? reason.name() : outcome.name();
    }
}

package com.signalguard.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Result of one reconciliation pass comparing local managed positions with exchange truth.
 */
@Data
@Builder
public class ReconciliationResult {

    private Instant timestamp;
    private String trigger;

    private int exchangePositionCount;
    private int localPositionCount;

    @Builder.Default
    private List<PositionMismatch> mismatches = new ArrayList<>();

    private int repairsApplied;
    private int repairFailures;
    private int alertsRaised;

    /** Pass stopped early because panic close was observed. */
    private boolean aborted;

    private long durationMs;

    public boolean hasMismatches() {
        return mismatches != null && !mismatches.isEmpty();
    }

    public int getTotalMismatches() {
        return mismatches != null ? mismatches.size() : 0;
    }
}

package com.signalguard.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of the one-time panic-close sweep.
 */
@Getter
@Builder
public class PanicSweepResult {

    private final boolean success;
    private final boolean alreadyRan;
    private final int ordersCancelled;
    private final int positionsClosed;

    @Builder.Default
    private final List<String> errors = new ArrayList<>();

    public static PanicSweepResult alreadyRan() {
        return PanicSweepResult.builder().success(true).alreadyRan(true).build();
    }
}

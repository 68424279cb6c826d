package com.signalguard.domain.model;

import com.signalguard.domain.enums.SafetyLevel;
import com.signalguard.domain.enums.SafetyTrigger;
import java.time.Instant;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable, versioned view of the process-wide safety state. Only the safety supervisor
 * creates new snapshots; everyone else reads them.
 */
@Value
@Builder(toBuilder = true)
public class SafetySnapshot {

    SafetyLevel level;

    @Builder.Default
    Set<SafetyTrigger> triggers = Set.of();

    String reason;
    Instant enteredAt;
    long version;

    public static SafetySnapshot initial(Instant now) {
        return SafetySnapshot.builder()
                .level(SafetyLevel.NORMAL)
                .reason("startup")
                .enteredAt(now)
                .version(0)
                .build();
    }

    public boolean allowsNewEntries() {
        return level.allowsNewEntries();
    }

    public boolean isPanic() {
        return level == SafetyLevel.PANIC_CLOSE;
    }
}

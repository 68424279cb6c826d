package com.signalguard.reconciliation;

import com.signalguard.domain.enums.OrphanPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "signalguard.reconciliation")
public class ReconciliationConfig {

    private boolean enabled = true;
    private long intervalMs = 15_000;

    /** Response to exchange positions with no local record. */
    private OrphanPolicy orphanPolicy = OrphanPolicy.NOTIFY_ONLY;

    /** Consecutive failed repairs on one position before the supervisor is told. */
    private int maxRepairFailures = 3;
}

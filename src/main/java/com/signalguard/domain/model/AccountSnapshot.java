package com.signalguard.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Account balance as reported by the exchange. Equity includes unrealized P&L.
 */
@Value
@Builder
public class AccountSnapshot {

    BigDecimal equity;
    BigDecimal available;

    @Builder.Default
    BigDecimal marginUsed = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal unrealizedPnl = BigDecimal.ZERO;

    /** Managed open positions; filled in by the intake path from local state. */
    @With
    int openPositionCount;

    Instant capturedAt;
}

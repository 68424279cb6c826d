package com.signalguard.domain.model;

import com.signalguard.domain.enums.Side;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Risk-approved, sized and exchange-ready plan derived from an accepted entry signal.
 *
 * <p>Owned by the order lifecycle manager once created. Size changes from partial fills are
 * tracked on the managed position, never written back here.
 */
@Value
@Builder(toBuilder = true)
public class OrderPlan {

    String planId;
    String signalId;
    String symbol;
    Side side;

    /** Rounded down to the symbol's quantity step; the sum of all legs for a split entry. */
    BigDecimal quantity;

    /** Leverage after the CAP/REJECT policy. */
    int leverage;

    /** Quantity-weighted average of the legs for a split entry. */
    BigDecimal entryPrice;
    OrderSpec entry;

    /** Further LIMIT legs of a split entry, placed after {@link #entry}; empty for a single entry. */
    @Builder.Default
    List<OrderSpec> scaleInEntries = List.of();
    StopLossSpec stopLoss;

    @Builder.Default
    List<TakeProfitLevel> takeProfits = List.of();

    BigDecimal riskAmount;
    BigDecimal notional;

    @Builder.Default
    List<String> warnings = List.of();
}

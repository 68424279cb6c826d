package com.signalguard.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Current price and symbol rules used by one risk evaluation. */
@Value
@Builder
public class MarketSnapshot {

    String symbol;
    BigDecimal currentPrice;
    SymbolRules rules;
}

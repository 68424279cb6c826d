package com.signalguard.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Exchange precision and tradability rules for one contract. */
@Value
@Builder
public class SymbolRules {

    String symbol;
    BigDecimal qtyStep;
    BigDecimal priceStep;
    BigDecimal minQty;
    boolean tradable;

    /** 24h quote-currency volume, null when the exchange did not report it. */
    BigDecimal quoteVolume24h;
}

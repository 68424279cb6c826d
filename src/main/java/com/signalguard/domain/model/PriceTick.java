package com.signalguard.domain.model;

import com.signalguard.domain.enums.PriceSource;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PriceTick {

    String symbol;
    BigDecimal price;
    PriceSource source;
    Instant at;
}

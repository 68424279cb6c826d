package com.signalguard.domain.model;

import com.signalguard.domain.enums.Side;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A position as reported by the exchange. */
@Value
@Builder(toBuilder = true)
public class ExchangePosition {

    String symbol;
    Side side;
    BigDecimal size;
    BigDecimal entryPrice;
    BigDecimal markPrice;

    /** Null when the exchange does not report one. */
    BigDecimal liquidationPrice;
}

package com.signalguard.domain.model;

import com.signalguard.domain.enums.OrderKind;
import com.signalguard.domain.enums.OrderPurpose;
import com.signalguard.domain.enums.OrderSide;
import com.signalguard.domain.enums.OrderStatus;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.enums.TradeSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** An order as reported by the exchange. */
@Value
@Builder(toBuilder = true)
public class ExchangeOrder {

    String orderId;
    String clientOrderId;
    String symbol;
    OrderSide side;
    OrderKind kind;
    BigDecimal quantity;

    @Builder.Default
    BigDecimal filledQuantity = BigDecimal.ZERO;

    BigDecimal price;
    BigDecimal triggerPrice;
    boolean reduceOnly;
    TradeSide tradeSide;
    Side holdSide;
    OrderPurpose purpose;
    OrderStatus status;

    /** Reduce-only on one-way accounts, or an explicit close trade-side on hedge accounts. */
    public boolean isClosing() {
        return reduceOnly || tradeSide == TradeSide.CLOSE;
    }
}

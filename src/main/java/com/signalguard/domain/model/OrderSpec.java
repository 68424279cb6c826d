package com.signalguard.domain.model;

import com.signalguard.domain.enums.OrderKind;
import com.signalguard.domain.enums.OrderPurpose;
import com.signalguard.domain.enums.OrderSide;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.enums.TradeSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Exchange-ready order instruction.
 *
 * <p>One-way accounts set {@code reduceOnly} on closing orders. Hedge accounts leave it false and
 * set {@code tradeSide=CLOSE} together with {@code holdSide}.
 */
@Value
@Builder(toBuilder = true)
public class OrderSpec {

    String clientOrderId;
    String symbol;
    OrderSide side;
    OrderKind kind;
    BigDecimal quantity;

    /** Limit price; null for MARKET and TRIGGER orders. */
    BigDecimal price;

    /** Trigger price for TRIGGER orders. */
    BigDecimal triggerPrice;

    boolean reduceOnly;
    TradeSide tradeSide;
    Side holdSide;
    Integer leverage;
    OrderPurpose purpose;

    public boolean isClosing() {
        return reduceOnly || tradeSide == TradeSide.CLOSE;
    }
}

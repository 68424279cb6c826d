package com.signalguard.oms;

import com.signalguard.config.ExchangeConfig;
import com.signalguard.domain.enums.AccountMode;
import com.signalguard.domain.enums.OrderKind;
import com.signalguard.domain.enums.OrderPurpose;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.enums.TradeSide;
import com.signalguard.domain.model.OrderSpec;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Builds exchange-ready order specs for the account's position mode.
 *
 * <ul>
 *   <li>ONE_WAY: closing orders carry {@code reduceOnly=true} on the opposite side</li>
 *   <li>HEDGE: closing orders carry {@code tradeSide=CLOSE} with {@code holdSide} set to the
 *       position side; entries carry {@code tradeSide=OPEN}</li>
 * </ul>
 *
 * <p>The close side is always SELL for a long and BUY for a short.
 */
@Component
public class CloseInstructionFactory {

    private final ExchangeConfig exchangeConfig;

    public CloseInstructionFactory(ExchangeConfig exchangeConfig) {
        this.exchangeConfig = exchangeConfig;
    }

    public AccountMode accountMode() {
        return exchangeConfig.getAccountMode();
    }

    /** Entry spec with the open instruction for hedge accounts. */
    public OrderSpec entry(OrderSpec base, Side side) {
        if (accountMode() == AccountMode.HEDGE) {
            return base.toBuilder().tradeSide(TradeSide.OPEN).holdSide(side).reduceOnly(false).build();
        }
        return base.toBuilder().reduceOnly(false).build();
    }

    public OrderSpec stopLoss(String symbol, Side side, BigDecimal quantity, BigDecimal triggerPrice) {
        return closing(symbol, side, quantity, OrderPurpose.STOP_LOSS)
                .kind(OrderKind.TRIGGER)
                .triggerPrice(triggerPrice)
                .build();
    }

    public OrderSpec takeProfit(String symbol, Side side, BigDecimal quantity, BigDecimal price) {
        return closing(symbol, side, quantity, OrderPurpose.TAKE_PROFIT)
                .kind(OrderKind.LIMIT)
                .price(price)
                .build();
    }

    /** Resting reduce order at the average entry, taking part of the position off at break-even. */
    public OrderSpec breakEvenReduce(String symbol, Side side, BigDecimal quantity, BigDecimal price) {
        return closing(symbol, side, quantity, OrderPurpose.BREAK_EVEN_REDUCE)
                .kind(OrderKind.LIMIT)
                .price(price)
                .build();
    }

    /** Market order closing part of the position. */
    public OrderSpec reduce(String symbol, Side side, BigDecimal quantity) {
        return closing(symbol, side, quantity, OrderPurpose.REDUCE)
                .kind(OrderKind.MARKET)
                .build();
    }

    /** Market order closing the whole position. */
    public OrderSpec close(String symbol, Side side, BigDecimal quantity) {
        return closing(symbol, side, quantity, OrderPurpose.CLOSE)
                .kind(OrderKind.MARKET)
                .build();
    }

    private OrderSpec.OrderSpecBuilder closing(String symbol, Side side, BigDecimal quantity, OrderPurpose purpose) {
        OrderSpec.OrderSpecBuilder builder = OrderSpec.builder()
                .clientOrderId(clientOrderId(purpose))
                .symbol(symbol)
                .side(side.closeSide())
                .quantity(quantity)
                .purpose(purpose);
        if (accountMode() == AccountMode.HEDGE) {
            return builder.reduceOnly(false).tradeSide(TradeSide.CLOSE).holdSide(side);
        }
        return builder.reduceOnly(true);
    }

    private static String clientOrderId(OrderPurpose purpose) {
        return "sg-" + purpose.name().toLowerCase(Locale.ROOT).replace('_', '-') + "-"
                + UUID.randomUUID().toString().substring(0, 8);
    }
}

package com.signalguard.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;

import com.signalguard.config.ExchangeConfig;
import com.signalguard.domain.enums.AccountMode;
import com.signalguard.domain.enums.OrderKind;
import com.signalguard.domain.enums.OrderPurpose;
import com.signalguard.domain.enums.OrderSide;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.enums.TradeSide;
import com.signalguard.domain.model.OrderSpec;
import com.signalguard.oms.CloseInstructionFactory;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for CloseInstructionFactory in one-way and hedge account modes. */
class CloseInstructionFactoryTest {

    private ExchangeConfig exchangeConfig;
    private CloseInstructionFactory closeInstructionFactory;

    @BeforeEach
    void setUp() {
        exchangeConfig = new ExchangeConfig();
        closeInstructionFactory = new CloseInstructionFactory(exchangeConfig);
    }

    private static OrderSpec baseEntry(OrderSide side) {
        return OrderSpec.builder()
                .clientOrderId("sg-abcdefgh-entry")
                .symbol("BTCUSDT")
                .side(side)
                .kind(OrderKind.MARKET)
                .quantity(BigDecimal.ONE)
                .purpose(OrderPurpose.ENTRY)
                .build();
    }

    @Nested
    @DisplayName("One-way account")
    class OneWay {

        @Test
        @DisplayName("Stop for a long is a reduce-only SELL trigger")
        void longStop() {
            OrderSpec spec = closeInstructionFactory.stopLoss("BTCUSDT", Side.LONG, BigDecimal.ONE, new BigDecimal("98"));

            assertThat(spec.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(spec.getKind()).isEqualTo(OrderKind.TRIGGER);
            assertThat(spec.getTriggerPrice()).isEqualByComparingTo("98");
            assertThat(spec.isReduceOnly()).isTrue();
            assertThat(spec.getTradeSide()).isNull();
            assertThat(spec.getPurpose()).isEqualTo(OrderPurpose.STOP_LOSS);
        }

        @Test
        @DisplayName("Close for a short is a reduce-only market BUY")
        void shortClose() {
            OrderSpec spec = closeInstructionFactory.close("BTCUSDT", Side.SHORT, new BigDecimal("0.5"));

            assertThat(spec.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(spec.getKind()).isEqualTo(OrderKind.MARKET);
            assertThat(spec.isReduceOnly()).isTrue();
            assertThat(spec.getClientOrderId()).startsWith("sg-close-");
        }

        @Test
        @DisplayName("Entry is never reduce-only")
        void entry() {
            OrderSpec spec = closeInstructionFactory.entry(baseEntry(OrderSide.BUY), Side.LONG);

            assertThat(spec.isReduceOnly()).isFalse();
            assertThat(spec.getHoldSide()).isNull();
        }
    }

    @Nested
    @DisplayName("Hedge account")
    class Hedge {

        @BeforeEach
        void hedge() {
            exchangeConfig.setAccountMode(AccountMode.HEDGE);
        }

        @Test
        @DisplayName("Take-profit for a long carries tradeSide CLOSE and holdSide LONG")
        void longTakeProfit() {
            OrderSpec spec = closeInstructionFactory.takeProfit("BTCUSDT", Side.LONG, BigDecimal.ONE, new BigDecimal("110"));

            assertThat(spec.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(spec.getKind()).isEqualTo(OrderKind.LIMIT);
            assertThat(spec.getTradeSide()).isEqualTo(TradeSide.CLOSE);
            assertThat(spec.getHoldSide()).isEqualTo(Side.LONG);
            assertThat(spec.isReduceOnly()).isFalse();
        }

        @Test
        @DisplayName("Entry for a short carries tradeSide OPEN and holdSide SHORT")
        void shortEntry() {
            OrderSpec spec = closeInstructionFactory.entry(baseEntry(OrderSide.SELL), Side.SHORT);

            assertThat(spec.getTradeSide()).isEqualTo(TradeSide.OPEN);
            assertThat(spec.getHoldSide()).isEqualTo(Side.SHORT);
            assertThat(spec.getClientOrderId()).isEqualTo("sg-abcdefgh-entry");
        }
    }
}

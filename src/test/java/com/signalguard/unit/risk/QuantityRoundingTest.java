package com.signalguard.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;

import com.signalguard.domain.model.TakeProfitLevel;
import com.signalguard.risk.QuantityRounding;
import com.signalguard.risk.QuantityRounding.LadderSlice;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for QuantityRounding step flooring and take-profit ladder splitting.
 */
class QuantityRoundingTest {

    private static final BigDecimal STEP = new BigDecimal("0.001");

    @Nested
    @DisplayName("Floor to step")
    class FloorToStep {

        @Test
        @DisplayName("Rounds down, never up")
        void roundsDown() {
            assertThat(QuantityRounding.floorToStep(new BigDecimal("1.23999"), STEP)).isEqualByComparingTo("1.239");
        }

        @Test
        @DisplayName("Coarse steps floor to whole multiples")
        void coarseStep() {
            assertThat(QuantityRounding.floorToStep(new BigDecimal("17"), new BigDecimal("5"))).isEqualByComparingTo("15");
        }

        @Test
        @DisplayName("Missing step leaves the value untouched")
        void noStep() {
            assertThat(QuantityRounding.floorToStep(new BigDecimal("1.23456"), null)).isEqualByComparingTo("1.23456");
        }
    }

    @Nested
    @DisplayName("Ladder split")
    class Ladder {

        private final List<TakeProfitLevel> threeLevels = List.of(
                new TakeProfitLevel(new BigDecimal("101"), new BigDecimal("0.33333333")),
                new TakeProfitLevel(new BigDecimal("102"), new BigDecimal("0.33333333")),
                new TakeProfitLevel(new BigDecimal("103"), new BigDecimal("0.33333333")));

        @Test
        @DisplayName("Slices always sum to the rounded total, the last level takes the remainder")
        void sumsToTotal() {
            List<LadderSlice> slices = QuantityRounding.splitLadder(new BigDecimal("1"), threeLevels, STEP, STEP);

            assertThat(slices).hasSize(3);
            assertThat(slices.get(0).quantity()).isEqualByComparingTo("0.333");
            assertThat(slices.get(2).quantity()).isEqualByComparingTo("0.334");
            BigDecimal sum = slices.stream().map(LadderSlice::quantity).reduce(BigDecimal.ZERO, BigDecimal::add);
            assertThat(sum).isEqualByComparingTo("1");
        }

        @Test
        @DisplayName("Slices below the minimum are folded into the previous kept level")
        void foldsSmallSlices() {
            List<LadderSlice> slices =
                    QuantityRounding.splitLadder(new BigDecimal("0.002"), threeLevels, STEP, STEP);

            BigDecimal sum = slices.stream().map(LadderSlice::quantity).reduce(BigDecimal.ZERO, BigDecimal::add);
            assertThat(sum).isEqualByComparingTo("0.002");
            assertThat(slices).allMatch(s -> s.quantity().compareTo(STEP) >= 0);
        }

        @Test
        @DisplayName("Empty ladder produces no slices")
        void emptyLadder() {
            assertThat(QuantityRounding.splitLadder(BigDecimal.ONE, List.of(), STEP, STEP)).isEmpty();
        }
    }
}

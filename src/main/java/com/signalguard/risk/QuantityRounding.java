package com.signalguard.risk;

import com.signalguard.domain.model.TakeProfitLevel;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Exchange precision helpers. Quantities and prices always round down: a size is never
 * rounded up past what the risk budget allows.
 */
public final class QuantityRounding {

    private QuantityRounding() {}

    /**
     * Rounds {@code value} down to a multiple of {@code step}. A null or non-positive step
     * leaves the value unchanged.
     */
    public static BigDecimal floorToStep(BigDecimal value, BigDecimal step) {
        if (value == null) {
            return null;
        }
        if (step == null || step.signum() <= 0) {
            return value;
        }
        BigDecimal steps = value.divide(step, 0, RoundingMode.FLOOR);
        return steps.multiply(step).setScale(Math.max(step.stripTrailingZeros().scale(), 0), RoundingMode.FLOOR);
    }

    /**
     * Splits {@code total} across the ladder by fraction, each slice rounded down. A slice that
     * rounds below {@code minQty} is dropped and its quantity moves to the last kept level, so
     * the slices always sum to the rounded total.
     *
     * @return one quantity per kept level, in ladder order; empty when nothing can be placed
     */
    public static List<LadderSlice> splitLadder(
            BigDecimal total, List<TakeProfitLevel> levels, BigDecimal qtyStep, BigDecimal minQty) {
        List<LadderSlice> slices = new ArrayList<>();
        BigDecimal rounded = floorToStep(total, qtyStep);
        if (levels == null || levels.isEmpty() || rounded == null || rounded.signum() <= 0) {
            return slices;
        }

        BigDecimal assigned = BigDecimal.ZERO;
        for (int i = 0; i < levels.size(); i++) {
            TakeProfitLevel level = levels.get(i);
            boolean last = i == levels.size() - 1;
            BigDecimal qty = last
                    ? rounded.subtract(assigned)
                    : floorToStep(rounded.multiply(level.getFraction()), qtyStep);
            if (qty.signum() <= 0 || (minQty != null && qty.compareTo(minQty) < 0)) {
                if (last && !slices.isEmpty()) {
                    LadderSlice previous = slices.remove(slices.size() - 1);
                    slices.add(new LadderSlice(previous.price(), previous.quantity().add(qty)));
                }
                continue;
            }
            slices.add(new LadderSlice(level.getPrice(), qty));
            assigned = assigned.add(qty);
        }
        return slices;
    }

    public record LadderSlice(BigDecimal price, BigDecimal quantity) {}
}

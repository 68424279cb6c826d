package com.signalguard.domain.model;

import com.signalguard.domain.enums.EntryType;
import com.signalguard.domain.enums.StopLossMode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Serializable copy of the parts of an {@link OrderPlan} needed to place the entry later,
 * kept on a position waiting for operator confirmation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderPlanSnapshot {

    private EntryType entryType;

    /** Price of the first leg; the average entry lives on the position. */
    private BigDecimal entryPrice;

    /** Size of the first leg. */
    private BigDecimal quantity;

    private BigDecimal stopPrice;
    private StopLossMode stopMode;

    @Builder.Default
    private List<EntryLeg> scaleInLegs = new ArrayList<>();

    /** One further LIMIT leg of a split entry. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EntryLeg {
        private BigDecimal price;
        private BigDecimal quantity;
    }
}

package com.signalguard.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One rung of a take-profit ladder: a price and the fraction of position closed there. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TakeProfitLevel {

    private BigDecimal price;
    private BigDecimal fraction;
}

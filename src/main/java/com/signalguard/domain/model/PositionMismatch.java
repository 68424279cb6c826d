package com.signalguard.domain.model;

import com.signalguard.domain.enums.MismatchType;
import com.signalguard.domain.enums.ResolutionStrategy;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * One divergence between a local managed position and exchange truth, with the resolution
 * that was applied (or the reason none was).
 */
@Data
@Builder
public class PositionMismatch {

    private String symbol;
    private String positionId;
    private MismatchType type;
    private ResolutionStrategy resolution;
    private BigDecimal localQuantity;
    private BigDecimal exchangeQuantity;
    private String detail;
    private boolean resolved;
}

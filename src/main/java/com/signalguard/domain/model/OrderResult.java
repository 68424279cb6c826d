package com.signalguard.domain.model;

import com.signalguard.domain.enums.OrderStatus;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OrderResult {

    String orderId;
    String clientOrderId;
    OrderStatus status;

    @Builder.Default
    BigDecimal filledQuantity = BigDecimal.ZERO;

    BigDecimal averagePrice;
}

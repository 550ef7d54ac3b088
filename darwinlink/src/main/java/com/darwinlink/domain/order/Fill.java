package com.darwinlink.domain.order;

import java.math.BigDecimal;
import java.time.LocalTime;

/**
 * Execution of part or all of an order.
 */
public record Fill(
    String orderId,
    String symbol,
    OrderSide side,
    long quantity,
    BigDecimal price,
    LocalTime time
) {
    public BigDecimal notional() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}

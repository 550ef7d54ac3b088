package com.darwinlink.domain.order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Point-in-time view of an order.
 *
 * In live mode built from ORDER lines sent by the daemon; in simulation mode
 * taken from the virtual order book. createdAt/updatedAt are null when the
 * daemon does not report them.
 */
public record Order(
    String orderId,
    String symbol,
    OrderSide side,
    OrderKind kind,
    long quantity,
    BigDecimal price,
    OrderStatus status,
    long filledQuantity,
    BigDecimal averageFillPrice,
    Instant createdAt,
    Instant updatedAt
) {
    public long remainingQuantity() {
        return quantity - filledQuantity;
    }

    public boolean isOpen() {
        return !status.isTerminal();
    }
}

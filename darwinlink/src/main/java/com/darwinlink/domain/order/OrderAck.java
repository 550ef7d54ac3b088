package com.darwinlink.domain.order;

import java.math.BigDecimal;

/**
 * Daemon answer to an order command (place, cancel, modify, confirm).
 *
 * A rejection is a normal outcome: status is REJECTED and the rejection
 * fields carry the daemon's error code and text.
 */
public record OrderAck(
    String orderId,
    String symbol,
    OrderStatus status,
    long statusCode,
    String operation,
    long quantity,
    BigDecimal price,
    long filledQuantity,
    long remainingQuantity,
    BigDecimal averageFillPrice,
    boolean confirmationRequired,
    Long rejectionCode,
    String rejectionMessage
) {
    public boolean isRejected() {
        return status == OrderStatus.REJECTED;
    }
}

package com.darwinlink.application.simulation;

import com.darwinlink.domain.order.OrderStatus;

/**
 * Requested transition is not allowed from the order's current status.
 */
public class InvalidOrderStateException extends RuntimeException {

    private final String orderId;
    private final OrderStatus status;

    public InvalidOrderStateException(String orderId, OrderStatus status, String action) {
        super(String.format("Cannot %s order %s in status %s", action, orderId, status));
        this.orderId = orderId;
        this.status = status;
    }

    public String getOrderId() {
        return orderId;
    }

    public OrderStatus getStatus() {
        return status;
    }
}

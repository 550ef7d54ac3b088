package com.darwinlink.application.simulation;

import com.darwinlink.domain.order.Order;
import com.darwinlink.domain.order.OrderKind;
import com.darwinlink.domain.order.OrderSide;
import com.darwinlink.domain.order.OrderStatus;
import com.darwinlink.infrastructure.protocol.CommandKind;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Mutable order inside the virtual book.
 *
 * Transitions: PENDING -> PARTIALLY_FILLED -> FILLED, and PENDING or
 * PARTIALLY_FILLED -> CANCELLED. Filled quantity only grows and never
 * exceeds quantity. Not thread-safe; the engine monitor guards it.
 */
final class SimulatedOrder {

    static final int PRICE_SCALE = 6;

    private final String orderId;
    private final String symbol;
    private final OrderSide side;
    private final OrderKind kind;
    private final long quantity;
    private final Instant createdAt;

    private BigDecimal price;
    private OrderStatus status = OrderStatus.PENDING;
    private long filledQuantity = 0;
    private BigDecimal filledNotional = BigDecimal.ZERO;    // Σ price × qty over fills
    private Instant updatedAt;

    SimulatedOrder(String orderId, String symbol, OrderSide side, OrderKind kind,
                   long quantity, BigDecimal price, Instant createdAt) {
        this.orderId = orderId;
        this.symbol = symbol;
        this.side = side;
        this.kind = kind;
        this.quantity = quantity;
        this.price = price;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    String orderId() {
        return orderId;
    }

    String symbol() {
        return symbol;
    }

    OrderSide side() {
        return side;
    }

    OrderKind kind() {
        return kind;
    }

    long quantity() {
        return quantity;
    }

    BigDecimal price() {
        return price;
    }

    OrderStatus status() {
        return status;
    }

    long filledQuantity() {
        return filledQuantity;
    }

    long remainingQuantity() {
        return quantity - filledQuantity;
    }

    boolean isOpen() {
        return !status.isTerminal();
    }

    /**
     * Verb the order was placed with, reported as the operation field.
     */
    String operation() {
        return CommandKind.forOrder(side, kind).verb();
    }

    /**
     * Quantity-weighted mean of all fill prices, null before the first fill.
     */
    BigDecimal averageFillPrice() {
        if (filledQuantity == 0) {
            return null;
        }
        return filledNotional.divide(BigDecimal.valueOf(filledQuantity), PRICE_SCALE, RoundingMode.HALF_EVEN);
    }

    void fill(long fillQuantity, BigDecimal fillPrice, Instant now) {
        if (!isOpen()) {
            throw new InvalidOrderStateException(orderId, status, "execute");
        }
        if (fillQuantity <= 0 || fillQuantity > remainingQuantity()) {
            throw new IllegalArgumentException("Fill quantity " + fillQuantity
                + " outside 1.." + remainingQuantity() + " for " + orderId);
        }
        filledQuantity += fillQuantity;
        filledNotional = filledNotional.add(fillPrice.multiply(BigDecimal.valueOf(fillQuantity)));
        status = filledQuantity == quantity ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
        updatedAt = now;
    }

    void cancel(Instant now) {
        if (!isOpen()) {
            throw new InvalidOrderStateException(orderId, status, "cancel");
        }
        status = OrderStatus.CANCELLED;
        updatedAt = now;
    }

    void reprice(BigDecimal newPrice, Instant now) {
        if (!isOpen()) {
            throw new InvalidOrderStateException(orderId, status, "modify");
        }
        price = newPrice;
        updatedAt = now;
    }

    Order snapshot() {
        return new Order(orderId, symbol, side, kind, quantity, price, status,
            filledQuantity, averageFillPrice(), createdAt, updatedAt);
    }
}

package com.darwinlink.domain.order;

import java.math.BigDecimal;

/**
 * Order placement intent.
 *
 * Parameters are checked when the request is turned into a wire command,
 * before anything is written to a socket.
 */
public record OrderRequest(
    String symbol,
    OrderSide side,
    OrderKind kind,
    long quantity,
    BigDecimal price,           // Limit / trigger price, null for MARKET
    BigDecimal trailAmount,     // TRAILING_STOP only
    Long visibleQuantity        // ICEBERG only
) {
    public static OrderRequest market(String symbol, OrderSide side, long quantity) {
        return new OrderRequest(symbol, side, OrderKind.MARKET, quantity, null, null, null);
    }

    public static OrderRequest limit(String symbol, OrderSide side, long quantity, BigDecimal price) {
        return new OrderRequest(symbol, side, OrderKind.LIMIT, quantity, price, null, null);
    }

    public static OrderRequest stop(String symbol, OrderSide side, long quantity, BigDecimal triggerPrice) {
        return new OrderRequest(symbol, side, OrderKind.STOP, quantity, triggerPrice, null, null);
    }

    public static OrderRequest trailingStop(String symbol, OrderSide side, long quantity,
                                            BigDecimal triggerPrice, BigDecimal trailAmount) {
        return new OrderRequest(symbol, side, OrderKind.TRAILING_STOP, quantity, triggerPrice, trailAmount, null);
    }

    public static OrderRequest iceberg(String symbol, OrderSide side, long quantity,
                                       BigDecimal price, long visibleQuantity) {
        return new OrderRequest(symbol, side, OrderKind.ICEBERG, quantity, price, null, visibleQuantity);
    }
}

package com.darwinlink.domain.order;

/**
 * Order kinds accepted by the daemon.
 */
public enum OrderKind {
    MARKET,         // Executes at market, no price
    LIMIT,          // Price = limit price
    STOP,           // Price = trigger level
    TRAILING_STOP,  // Price = initial trigger, trails by a fixed amount
    ICEBERG;        // Price = limit price, only a visible slice is shown

    public boolean requiresPrice() {
        return this != MARKET;
    }
}

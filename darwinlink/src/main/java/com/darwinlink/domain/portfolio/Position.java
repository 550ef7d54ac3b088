package com.darwinlink.domain.portfolio;

import java.math.BigDecimal;

/**
 * Net holding in one symbol.
 *
 * quantity is signed: positive long, negative short. Never created by a
 * client call, only as a side effect of fills (simulation) or read from the
 * daemon (live).
 */
public record Position(
    String symbol,
    long quantity,
    BigDecimal averageCost,
    BigDecimal lastPrice,   // Null when the daemon does not report it
    BigDecimal gain         // Unrealized P&L at lastPrice
) {
    public boolean isLong() {
        return quantity > 0;
    }

    public boolean isShort() {
        return quantity < 0;
    }

    /**
     * Market value at the last known price, or at cost when no price is known.
     */
    public BigDecimal marketValue() {
        BigDecimal mark = lastPrice != null ? lastPrice : averageCost;
        return mark.multiply(BigDecimal.valueOf(quantity));
    }
}

package com.darwinlink.domain.market;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * OHLCV candle from the historical port.
 */
public record Candle(
    String symbol,
    LocalDateTime timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    long volume
) {
    /**
     * Check if candle is bullish (close > open).
     */
    public boolean isBullish() {
        return close.compareTo(open) > 0;
    }

    /**
     * High minus low.
     */
    public BigDecimal range() {
        return high.subtract(low);
    }
}

package com.darwinlink.domain.market;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Single trade print from tick-by-tick history.
 */
public record Tick(
    String symbol,
    LocalDateTime timestamp,
    BigDecimal price,
    long size
) {}

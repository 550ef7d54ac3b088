package com.darwinlink.domain.portfolio;

import java.math.BigDecimal;
import java.time.LocalTime;

/**
 * Read-only account projection, valid only for the response it came from.
 */
public record AccountSnapshot(
    LocalTime time,
    String accountCode,
    BigDecimal liquidity,
    BigDecimal gain,
    BigDecimal openProfitLoss,
    BigDecimal equity,
    String environment
) {}

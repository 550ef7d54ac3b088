package com.darwinlink.domain.portfolio;

import java.math.BigDecimal;
import java.time.LocalTime;

/**
 * Buying power split by segment, as reported by INFOAVAILABILITY.
 */
public record Availability(
    LocalTime time,
    BigDecimal stockAvailability,
    BigDecimal stockAvailabilityMargin,
    BigDecimal derivativesAvailability,
    BigDecimal derivativesAvailabilityMargin,
    BigDecimal totalLiquidity
) {}

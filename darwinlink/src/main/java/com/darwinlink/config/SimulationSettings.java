package com.darwinlink.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Starting state of a simulated account.
 *
 * Loaded from darwin-simulation.json by {@link SimulationSettingsLoader}.
 */
public record SimulationSettings(
    @JsonProperty("accountCode")
    String accountCode,             // Reported in INFOACCOUNT

    @JsonProperty("initialLiquidity")
    BigDecimal initialLiquidity,    // Cash at session start

    @JsonProperty("environment")
    String environment,             // INFOACCOUNT environment field

    @JsonProperty("release")
    String release,                 // DARWIN_STATUS release field

    @JsonProperty("orderIdPrefix")
    String orderIdPrefix            // Simulated ids are prefix + 6-digit sequence
) {
    public static SimulationSettings defaults() {
        return new SimulationSettings(
            "SIM1234",
            new BigDecimal("10000"),
            "SIM",
            "SIMULATION",
            "SIM"
        );
    }

    public boolean isValid() {
        return accountCode != null && !accountCode.isBlank()
            && initialLiquidity != null && initialLiquidity.signum() >= 0
            && environment != null
            && orderIdPrefix != null && !orderIdPrefix.isBlank()
            && orderIdPrefix.chars().noneMatch(c -> c == ';' || c == ',' || Character.isWhitespace(c));
    }
}

package com.evermark.reward;

import java.math.BigDecimal;

/**
 * Reward multiplier step table keyed by percentage of voting power delegated in the current cycle.
 * Lower bounds are inclusive; declared highest first so the first match wins.
 */
public enum MultiplierTier {

    FULL(100, new BigDecimal("2.00")),
    HIGH(75, new BigDecimal("1.50")),
    MEDIUM(50, new BigDecimal("1.25")),
    BASE(0, new BigDecimal("1.00"));

    private final long minPercentage;
    private final BigDecimal multiplier;

    MultiplierTier(long minPercentage, BigDecimal multiplier) {
        this.minPercentage = minPercentage;
        this.multiplier = multiplier;
    }

    public long getMinPercentage() {
        return minPercentage;
    }

    public BigDecimal getMultiplier() {
        return multiplier;
    }

    public static MultiplierTier forPercentage(long delegationPercentage) {
        for (MultiplierTier tier : values()) {
            if (delegationPercentage >= tier.minPercentage) {
                return tier;
            }
        }
        return BASE;
    }
}

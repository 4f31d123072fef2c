package com.evermark.reward;

import java.math.BigDecimal;

/**
 * Additive bonus by number of cycles, out of the last four, with at least one delegate action.
 */
public enum ConsistencyBonusTier {

    FOUR_WEEKS(4, new BigDecimal("0.20")),
    THREE_WEEKS(3, new BigDecimal("0.10")),
    TWO_WEEKS(2, new BigDecimal("0.05")),
    NONE(0, new BigDecimal("0.00"));

    private final int minWeeks;
    private final BigDecimal bonus;

    ConsistencyBonusTier(int minWeeks, BigDecimal bonus) {
        this.minWeeks = minWeeks;
        this.bonus = bonus;
    }

    public int getMinWeeks() {
        return minWeeks;
    }

    public BigDecimal getBonus() {
        return bonus;
    }

    public static ConsistencyBonusTier forWeeks(int consistencyWeeks) {
        for (ConsistencyBonusTier tier : values()) {
            if (consistencyWeeks >= tier.minWeeks) {
                return tier;
            }
        }
        return NONE;
    }
}

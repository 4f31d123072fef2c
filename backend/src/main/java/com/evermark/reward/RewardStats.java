package com.evermark.reward;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Reward-affecting metrics for one account at query time. Derived on demand, never persisted.
 * {@code totalDelegated}/{@code totalAvailable} echo the authoritative inputs; consistency fields come from the
 * local ledger and are best-effort.
 */
public record RewardStats(
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger totalDelegated,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger totalAvailable,
        long delegationPercentage,
        BigDecimal rewardMultiplier,
        int consistencyWeeks,
        BigDecimal consistencyBonus,
        int currentCycleDelegations
) {

    /** Multiplier callers present to users: rewardMultiplier + consistencyBonus. */
    @JsonProperty("effectiveMultiplier")
    public BigDecimal effectiveMultiplier() {
        return rewardMultiplier.add(consistencyBonus);
    }
}

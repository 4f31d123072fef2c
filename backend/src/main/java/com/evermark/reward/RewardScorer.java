package com.evermark.reward;

import com.evermark.domain.DelegationRecord;

import java.math.BigInteger;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pure reward derivation: percentage of voting power used, tiered multiplier and rolling consistency bonus.
 * Percentage and multiplier use only the authoritative current-cycle total and voting power; the ledger feeds
 * the consistency lookback and the current-cycle activity count.
 */
public final class RewardScorer {

    /** Cycles examined for consistency: currentCycle and the three before it. */
    public static final int CONSISTENCY_WINDOW = 4;

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private RewardScorer() {
    }

    /**
     * @param currentCycleNetDelegated authoritative current-cycle delegated total; null treated as zero
     * @param totalVotingPower         authoritative voting power; null or zero yields 0%
     * @param ledger                   the account's local ledger, possibly incomplete
     * @param currentCycle             authoritative current cycle
     */
    public static RewardStats score(BigInteger currentCycleNetDelegated, BigInteger totalVotingPower,
                                    Collection<DelegationRecord> ledger, long currentCycle) {
        BigInteger delegated = nonNegative(currentCycleNetDelegated, "currentCycleNetDelegated");
        BigInteger power = nonNegative(totalVotingPower, "totalVotingPower");
        if (currentCycle < 0) {
            throw new IllegalArgumentException("currentCycle must be non-negative, got: " + currentCycle);
        }
        Collection<DelegationRecord> records = ledger != null ? ledger : List.of();

        long percentage = delegationPercentage(delegated, power);
        int weeks = consistencyWeeks(records, currentCycle);
        int currentCycleDelegations = (int) records.stream().filter(r -> r.cycle() == currentCycle).count();
        return new RewardStats(
                delegated,
                power,
                percentage,
                MultiplierTier.forPercentage(percentage).getMultiplier(),
                weeks,
                ConsistencyBonusTier.forWeeks(weeks).getBonus(),
                currentCycleDelegations);
    }

    /** floor(delegated * 100 / power); 0 when power is 0. */
    static long delegationPercentage(BigInteger delegated, BigInteger power) {
        if (power.signum() == 0) {
            return 0;
        }
        return delegated.multiply(HUNDRED).divide(power).min(LONG_MAX).longValue();
    }

    /** Number of cycles in the window with at least one DELEGATE record; undelegate-only cycles do not count. */
    static int consistencyWeeks(Collection<DelegationRecord> ledger, long currentCycle) {
        long oldest = currentCycle - (CONSISTENCY_WINDOW - 1);
        Set<Long> active = new HashSet<>();
        for (DelegationRecord record : ledger) {
            if (record.isDelegate() && record.cycle() >= oldest && record.cycle() <= currentCycle) {
                active.add(record.cycle());
            }
        }
        return active.size();
    }

    private static BigInteger nonNegative(BigInteger value, String name) {
        if (value == null) {
            return BigInteger.ZERO;
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be non-negative, got: " + value);
        }
        return value;
    }
}

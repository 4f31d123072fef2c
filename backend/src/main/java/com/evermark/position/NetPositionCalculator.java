package com.evermark.position;

import com.evermark.domain.DelegationRecord;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Folds a ledger into per-item net delegation balances. Net = sum(delegate) - sum(undelegate) over the whole
 * ledger; items whose net is zero or negative are dropped (a fully unwound delegation is a normal end state).
 * Results depend only on which records are present, never on their order.
 */
public final class NetPositionCalculator {

    private static final Comparator<NetDelegation> BY_AMOUNT_DESC = Comparator
            .comparing(NetDelegation::netAmount, Comparator.reverseOrder())
            .thenComparing(NetDelegation::itemId);

    private NetPositionCalculator() {
    }

    /**
     * @return itemId to strictly positive net amount; iteration order is unspecified
     */
    public static Map<String, BigInteger> computeNetPositions(Collection<DelegationRecord> ledger) {
        if (ledger == null || ledger.isEmpty()) {
            return Map.of();
        }
        Map<String, BigInteger> running = new HashMap<>();
        for (DelegationRecord record : ledger) {
            running.merge(record.itemId(), record.signedAmount(), BigInteger::add);
        }
        running.values().removeIf(net -> net.signum() <= 0);
        return Map.copyOf(running);
    }

    public static Set<String> supportedItems(Collection<DelegationRecord> ledger) {
        return computeNetPositions(ledger).keySet();
    }

    /** Records of the given cycle, in ledger order. */
    public static List<DelegationRecord> cycleSlice(Collection<DelegationRecord> ledger, long cycle) {
        if (ledger == null) {
            return List.of();
        }
        return ledger.stream().filter(r -> r.cycle() == cycle).toList();
    }

    /** Records of one item, in ledger order. */
    public static List<DelegationRecord> itemHistory(Collection<DelegationRecord> ledger, String itemId) {
        if (ledger == null) {
            return List.of();
        }
        return ledger.stream().filter(r -> Objects.equals(r.itemId(), itemId)).toList();
    }

    /** Net positions sorted by amount descending, then itemId. */
    public static List<NetDelegation> rankedNetDelegations(Collection<DelegationRecord> ledger) {
        return computeNetPositions(ledger).entrySet().stream()
                .map(e -> new NetDelegation(e.getKey(), e.getValue()))
                .sorted(BY_AMOUNT_DESC)
                .toList();
    }
}

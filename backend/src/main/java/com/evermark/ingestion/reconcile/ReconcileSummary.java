package com.evermark.ingestion.reconcile;

import com.evermark.ingestion.normalizer.RejectionReason;

import java.util.Map;

/**
 * Outcome of one reconcile call: new records, already-known records and rejected raw events.
 */
public record ReconcileSummary(
        String accountId,
        int inserted,
        int duplicates,
        int rejected,
        Map<RejectionReason, Integer> rejectionsByReason
) {

    public ReconcileSummary {
        rejectionsByReason = Map.copyOf(rejectionsByReason);
    }

    public static ReconcileSummary empty(String accountId) {
        return new ReconcileSummary(accountId, 0, 0, 0, Map.of());
    }

    public boolean hasWarnings() {
        return rejected > 0;
    }
}

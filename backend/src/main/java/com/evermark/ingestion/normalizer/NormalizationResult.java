package com.evermark.ingestion.normalizer;

import com.evermark.domain.DelegationRecord;

/**
 * Either a canonical record or the reason the raw event was rejected; exactly one is non-null.
 */
public record NormalizationResult(DelegationRecord record, RejectionReason rejection) {

    public static NormalizationResult accepted(DelegationRecord record) {
        return new NormalizationResult(record, null);
    }

    public static NormalizationResult rejected(RejectionReason reason) {
        return new NormalizationResult(null, reason);
    }

    public boolean isAccepted() {
        return record != null;
    }
}

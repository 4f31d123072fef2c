package com.evermark.ingestion.normalizer;

/**
 * Why a raw delegation event did not become a ledger record.
 */
public enum RejectionReason {
    EMPTY_EVENT,
    MISSING_ACCOUNT,
    ACCOUNT_MISMATCH,
    MISSING_ITEM,
    NON_POSITIVE_AMOUNT,
    INVALID_DIRECTION,
    INVALID_CYCLE,
    MISSING_TX_HASH
}

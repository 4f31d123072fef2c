package com.evermark.ingestion.store;

/**
 * Result of an idempotent ledger write.
 */
public enum PutOutcome {
    INSERTED,
    ALREADY_PRESENT
}

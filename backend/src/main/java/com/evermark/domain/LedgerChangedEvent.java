package com.evermark.domain;

/**
 * Application event: new records were appended to an account's ledger. Published synchronously before the
 * reconcile call returns, so listeners can invalidate derived views.
 */
public record LedgerChangedEvent(String accountId, int inserted) {
}

package com.evermark.domain;

/**
 * Application event: an account's ledger was cleared on user request.
 */
public record LedgerResetEvent(String accountId, long removed) {
}

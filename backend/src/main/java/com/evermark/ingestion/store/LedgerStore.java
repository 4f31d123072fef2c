package com.evermark.ingestion.store;

import com.evermark.domain.DelegationRecord;

import java.util.List;

/**
 * Durable, append-only, per-account collection of delegation records keyed by sourceEventId.
 * <p>
 * Writes are insert-or-noop per record. A record reported {@link PutOutcome#INSERTED} is durable when the call
 * returns, so a following {@link #getAll(String)} in the same process includes it.
 */
public interface LedgerStore {

    /**
     * Append one record unless the account's ledger already holds its sourceEventId.
     *
     * @throws LedgerStoreException on persistence failure
     */
    PutOutcome put(String accountId, DelegationRecord record);

    /**
     * Append many records with batched writes. Records repeated within the batch count as already present after
     * their first occurrence.
     *
     * @return one outcome per input record, in input order
     * @throws LedgerStoreException on persistence failure; earlier confirmed writes are kept
     */
    List<PutOutcome> putAll(String accountId, List<DelegationRecord> records);

    /**
     * Full ledger of the account in insertion order; empty if the account was never observed.
     */
    List<DelegationRecord> getAll(String accountId);

    /**
     * Irreversibly delete the account's ledger. Only for explicit user-initiated resets.
     *
     * @return number of records removed
     */
    long clear(String accountId);
}

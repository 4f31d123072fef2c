package com.evermark.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for ledger_records. Used by MongoLedgerStore only.
 */
public interface LedgerRecordRepository extends MongoRepository<LedgerRecordDocument, String> {

    /** Full ledger of an account in insertion order. */
    List<LedgerRecordDocument> findByAccountIdOrderBySequenceAsc(String accountId);

    /** Highest sequence of an account; next insert continues from it. */
    Optional<LedgerRecordDocument> findFirstByAccountIdOrderBySequenceDesc(String accountId);

    /** Dedup probe: which of the given source event ids the account's ledger already holds. */
    @Query(value = "{ 'accountId' : ?0, 'sourceEventId' : { '$in' : ?1 } }", fields = "{ 'sourceEventId' : 1 }")
    List<LedgerRecordDocument> findSourceEventIdsByAccountIdAndSourceEventIdIn(
            String accountId, Collection<String> sourceEventIds);

    long countByAccountId(String accountId);

    long deleteByAccountId(String accountId);
}

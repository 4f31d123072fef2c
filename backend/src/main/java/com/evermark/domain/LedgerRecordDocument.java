package com.evermark.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Persisted form of a {@link DelegationRecord}. Uniqueness: (accountId, sourceEventId), which makes a repeated
 * write of the same event a no-op. {@code sequence} is the per-account insertion order; ledgers are read back in
 * that order, not by cycle or timestamp, since historical backfills may arrive late.
 * Amount is stored as a decimal string to keep full precision.
 */
@Document(collection = "ledger_records")
@CompoundIndexes({
    @CompoundIndex(name = "account_sourceEventId", def = "{'accountId': 1, 'sourceEventId': 1}", unique = true),
    @CompoundIndex(name = "account_sequence", def = "{'accountId': 1, 'sequence': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LedgerRecordDocument {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String accountId;
    private String itemId;
    private String amount;
    private long cycle;
    private DelegationDirection direction;
    private Instant observedAt;
    private String sourceEventId;
    private long sequence;
    private Instant insertedAt;

    public static LedgerRecordDocument from(DelegationRecord record, long sequence, Instant insertedAt) {
        LedgerRecordDocument doc = new LedgerRecordDocument();
        doc.setAccountId(record.accountId());
        doc.setItemId(record.itemId());
        doc.setAmount(record.amount().toString());
        doc.setCycle(record.cycle());
        doc.setDirection(record.direction());
        doc.setObservedAt(record.observedAt());
        doc.setSourceEventId(record.sourceEventId());
        doc.setSequence(sequence);
        doc.setInsertedAt(insertedAt);
        return doc;
    }

    public DelegationRecord toRecord() {
        return new DelegationRecord(accountId, itemId, new BigInteger(amount), cycle, direction, observedAt,
                sourceEventId);
    }
}

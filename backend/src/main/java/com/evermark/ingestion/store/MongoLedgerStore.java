package com.evermark.ingestion.store;

import com.evermark.domain.DelegationRecord;
import com.evermark.domain.LedgerRecordDocument;
import com.evermark.domain.LedgerRecordRepository;
import com.evermark.ingestion.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * MongoDB-backed {@link LedgerStore}. Dedup relies on the unique (accountId, sourceEventId) index, so insert-or-noop
 * holds per record even with writers in other processes. Callers serialize writes per account; sequence numbers
 * are assigned under that assumption.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoLedgerStore implements LedgerStore {

    private final LedgerRecordRepository repository;
    private final LedgerProperties properties;

    @Override
    public PutOutcome put(String accountId, DelegationRecord record) {
        return putAll(accountId, List.of(record)).get(0);
    }

    @Override
    public List<PutOutcome> putAll(String accountId, List<DelegationRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        records.forEach(r -> requireSameAccount(accountId, r));

        PutOutcome[] outcomes = new PutOutcome[records.size()];
        List<Integer> pending = new ArrayList<>();
        int inserted = 0;
        try {
            Set<String> seen = existingSourceEventIds(accountId, records);
            for (int i = 0; i < records.size(); i++) {
                if (seen.add(records.get(i).sourceEventId())) {
                    pending.add(i);
                } else {
                    outcomes[i] = PutOutcome.ALREADY_PRESENT;
                }
            }
            if (pending.isEmpty()) {
                return Arrays.asList(outcomes);
            }

            long sequence = nextSequence(accountId);
            Instant now = Instant.now();
            int batchSize = properties.getWriteBatchSize();
            for (int from = 0; from < pending.size(); from += batchSize) {
                List<Integer> chunk = pending.subList(from, Math.min(from + batchSize, pending.size()));
                List<LedgerRecordDocument> docs = new ArrayList<>(chunk.size());
                for (int index : chunk) {
                    docs.add(LedgerRecordDocument.from(records.get(index), sequence++, now));
                }
                try {
                    repository.insert(docs);
                    chunk.forEach(index -> outcomes[index] = PutOutcome.INSERTED);
                    inserted += chunk.size();
                } catch (DuplicateKeyException e) {
                    // Another process wrote some of these ids since the probe; settle the chunk record by record.
                    log.debug("Duplicate key in bulk insert for {}, retrying {} records singly", accountId, docs.size());
                    for (int k = 0; k < chunk.size(); k++) {
                        PutOutcome outcome = insertOne(docs.get(k));
                        outcomes[chunk.get(k)] = outcome;
                        if (outcome == PutOutcome.INSERTED) {
                            inserted++;
                        }
                    }
                }
            }
        } catch (DataAccessException e) {
            throw new LedgerStoreException(accountId, inserted,
                    "Ledger write failed for " + accountId + " after " + inserted + " inserts: " + e.getMessage(), e);
        }
        return Arrays.asList(outcomes);
    }

    @Override
    public List<DelegationRecord> getAll(String accountId) {
        try {
            return repository.findByAccountIdOrderBySequenceAsc(accountId).stream()
                    .map(LedgerRecordDocument::toRecord)
                    .toList();
        } catch (DataAccessException e) {
            throw new LedgerStoreException(accountId, 0, "Ledger read failed for " + accountId, e);
        }
    }

    @Override
    public long clear(String accountId) {
        try {
            return repository.deleteByAccountId(accountId);
        } catch (DataAccessException e) {
            throw new LedgerStoreException(accountId, 0, "Ledger clear failed for " + accountId, e);
        }
    }

    private PutOutcome insertOne(LedgerRecordDocument doc) {
        try {
            repository.insert(doc);
            return PutOutcome.INSERTED;
        } catch (DuplicateKeyException e) {
            return PutOutcome.ALREADY_PRESENT;
        }
    }

    private Set<String> existingSourceEventIds(String accountId, List<DelegationRecord> records) {
        List<String> ids = records.stream().map(DelegationRecord::sourceEventId).distinct().toList();
        Set<String> existing = new HashSet<>();
        int batchSize = properties.getWriteBatchSize();
        for (int from = 0; from < ids.size(); from += batchSize) {
            List<String> slice = ids.subList(from, Math.min(from + batchSize, ids.size()));
            repository.findSourceEventIdsByAccountIdAndSourceEventIdIn(accountId, slice)
                    .forEach(doc -> existing.add(doc.getSourceEventId()));
        }
        return existing;
    }

    private long nextSequence(String accountId) {
        return repository.findFirstByAccountIdOrderBySequenceDesc(accountId)
                .map(doc -> doc.getSequence() + 1)
                .orElse(0L);
    }

    private static void requireSameAccount(String accountId, DelegationRecord record) {
        if (!accountId.equals(record.accountId())) {
            throw new IllegalArgumentException("Record " + record.sourceEventId() + " belongs to "
                    + record.accountId() + ", not " + accountId);
        }
    }
}

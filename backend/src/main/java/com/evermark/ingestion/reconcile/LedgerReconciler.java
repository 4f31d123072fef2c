package com.evermark.ingestion.reconcile;

import com.evermark.common.AccountIds;
import com.evermark.common.AccountLocks;
import com.evermark.domain.DelegationRecord;
import com.evermark.domain.LedgerChangedEvent;
import com.evermark.domain.RawDelegationEvent;
import com.evermark.ingestion.config.LedgerProperties;
import com.evermark.ingestion.normalizer.DelegationEventNormalizer;
import com.evermark.ingestion.normalizer.NormalizationResult;
import com.evermark.ingestion.normalizer.RejectionReason;
import com.evermark.ingestion.store.LedgerStore;
import com.evermark.ingestion.store.LedgerStoreException;
import com.evermark.ingestion.store.PutOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Merges newly observed raw events into the account's durable ledger: normalize, then idempotent put.
 * Same-account calls are serialized by a per-account lock; different accounts run in parallel.
 * Replaying a batch is safe: already-known events are counted as duplicates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerReconciler {

    /** Longest deadline honored; larger timeouts are capped to it. */
    static final Duration MAX_TIMEOUT = Duration.ofDays(365);

    private final DelegationEventNormalizer normalizer;
    private final LedgerStore ledgerStore;
    private final LedgerProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final AccountLocks accountLocks;

    public ReconcileSummary reconcile(String accountId, List<RawDelegationEvent> incomingEvents) {
        return reconcile(accountId, incomingEvents, properties.getDefaultReconcileTimeout());
    }

    /**
     * Reconcile a batch under a deadline. The deadline (and thread interruption) is checked between write chunks;
     * on cancellation the chunks already written stay durable.
     *
     * @param timeout null means the configured default; capped at {@link #MAX_TIMEOUT} either way
     * @throws ReconcileException STORE_FAILURE, CANCELLED or LOCK_TIMEOUT, carrying the partial summary
     */
    public ReconcileSummary reconcile(String accountId, List<RawDelegationEvent> incomingEvents, Duration timeout) {
        String account = AccountIds.normalize(accountId);
        Instant deadline = Instant.now().plus(effectiveTimeout(timeout));
        if (incomingEvents == null || incomingEvents.isEmpty()) {
            return ReconcileSummary.empty(account);
        }

        ReentrantLock lock = accountLocks.lockFor(account);
        long waitMs = Math.max(0, Math.min(properties.getLockTimeout().toMillis(),
                Duration.between(Instant.now(), deadline).toMillis()));
        boolean acquired;
        try {
            acquired = lock.tryLock(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReconcileException(ReconcileException.CANCELLED, ReconcileSummary.empty(account),
                    "Interrupted while waiting for ledger lock of " + account, e);
        }
        if (!acquired) {
            throw new ReconcileException(ReconcileException.LOCK_TIMEOUT, ReconcileSummary.empty(account),
                    "Timed out after " + waitMs + "ms waiting for ledger lock of " + account);
        }
        try {
            return reconcileLocked(account, incomingEvents, deadline);
        } finally {
            lock.unlock();
        }
    }

    private ReconcileSummary reconcileLocked(String account, List<RawDelegationEvent> incomingEvents, Instant deadline) {
        List<DelegationRecord> records = new ArrayList<>(incomingEvents.size());
        Map<RejectionReason, Integer> rejections = new EnumMap<>(RejectionReason.class);
        for (RawDelegationEvent raw : incomingEvents) {
            NormalizationResult result = normalizer.normalize(account, raw);
            if (result.isAccepted()) {
                records.add(result.record());
            } else {
                rejections.merge(result.rejection(), 1, Integer::sum);
                log.debug("Rejected delegation event for {}: {} ({})", account, result.rejection(), raw);
            }
        }
        int rejected = rejections.values().stream().mapToInt(Integer::intValue).sum();
        if (rejected > 0) {
            log.warn("Reconcile {}: rejected {} of {} events {}", account, rejected, incomingEvents.size(), rejections);
        }

        int inserted = 0;
        int duplicates = 0;
        boolean storeFailed = false;
        int batchSize = properties.getWriteBatchSize();
        try {
            for (int from = 0; from < records.size(); from += batchSize) {
                if (Thread.currentThread().isInterrupted() || Instant.now().isAfter(deadline)) {
                    throw new ReconcileException(ReconcileException.CANCELLED,
                            new ReconcileSummary(account, inserted, duplicates, rejected, rejections),
                            "Reconcile of " + account + " cancelled after " + inserted + " inserts");
                }
                List<DelegationRecord> chunk = records.subList(from, Math.min(from + batchSize, records.size()));
                List<PutOutcome> outcomes;
                try {
                    outcomes = ledgerStore.putAll(account, chunk);
                } catch (LedgerStoreException e) {
                    // A failed bulk write may have persisted more than it reports.
                    storeFailed = true;
                    inserted += e.getInsertedBeforeFailure();
                    log.warn("Reconcile {}: store failure after {} inserts: {}", account, inserted, e.getMessage());
                    throw new ReconcileException(ReconcileException.STORE_FAILURE,
                            new ReconcileSummary(account, inserted, duplicates, rejected, rejections),
                            e.getMessage(), e);
                }
                for (PutOutcome outcome : outcomes) {
                    if (outcome == PutOutcome.INSERTED) {
                        inserted++;
                    } else {
                        duplicates++;
                    }
                }
            }
        } finally {
            if (inserted > 0 || storeFailed) {
                applicationEventPublisher.publishEvent(new LedgerChangedEvent(account, inserted));
            }
        }

        ReconcileSummary summary = new ReconcileSummary(account, inserted, duplicates, rejected, rejections);
        if (inserted > 0) {
            log.info("Reconcile {}: inserted={} duplicates={} rejected={}", account, inserted, duplicates, rejected);
        } else {
            log.debug("Reconcile {}: nothing new (duplicates={} rejected={})", account, duplicates, rejected);
        }
        return summary;
    }

    private Duration effectiveTimeout(Duration timeout) {
        if (timeout == null) {
            return properties.getDefaultReconcileTimeout();
        }
        if (timeout.compareTo(MAX_TIMEOUT) > 0) {
            return MAX_TIMEOUT;
        }
        return timeout.compareTo(MAX_TIMEOUT.negated()) < 0 ? MAX_TIMEOUT.negated() : timeout;
    }
}

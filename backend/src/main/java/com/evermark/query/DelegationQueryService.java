package com.evermark.query;

import com.evermark.common.AccountIds;
import com.evermark.common.AccountLocks;
import com.evermark.config.CaffeineConfig;
import com.evermark.domain.DelegationRecord;
import com.evermark.domain.LedgerResetEvent;
import com.evermark.ingestion.store.LedgerStore;
import com.evermark.position.NetDelegation;
import com.evermark.position.NetPositionCalculator;
import com.evermark.reward.RewardScorer;
import com.evermark.reward.RewardStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Read-only views over an account's ledger: supported items, cycle slices, net positions and reward stats.
 * Ledgers are served from ledgerCache and loaded from the {@link LedgerStore} on miss. No network I/O.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DelegationQueryService {

    private final LedgerStore ledgerStore;
    private final CacheManager cacheManager;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final AccountLocks accountLocks;

    /** Full ledger in insertion order. */
    public List<DelegationRecord> getLedger(String accountId) {
        String account = AccountIds.normalize(accountId);
        Cache cache = cacheManager.getCache(CaffeineConfig.LEDGER_CACHE);
        if (cache == null) {
            return load(account);
        }
        try {
            return cache.get(account, () -> load(account));
        } catch (Cache.ValueRetrievalException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /** Items with a strictly positive lifetime net position. */
    public Set<String> getSupportedItems(String accountId) {
        return NetPositionCalculator.supportedItems(getLedger(accountId));
    }

    public List<DelegationRecord> getCycleDelegations(String accountId, long cycle) {
        return NetPositionCalculator.cycleSlice(getLedger(accountId), cycle);
    }

    public List<DelegationRecord> getItemDelegations(String accountId, String itemId) {
        return NetPositionCalculator.itemHistory(getLedger(accountId), itemId);
    }

    /** Positive net positions, largest first. */
    public List<NetDelegation> getNetDelegations(String accountId) {
        return NetPositionCalculator.rankedNetDelegations(getLedger(accountId));
    }

    /**
     * Reward stats from authoritative current-cycle inputs plus the local ledger for the consistency lookback.
     * Callers should keep the result for the duration of a request rather than recompute it per access.
     */
    public RewardStats getStats(String accountId, long currentCycle, BigInteger totalVotingPower,
                                BigInteger currentCycleNetDelegated) {
        return RewardScorer.score(currentCycleNetDelegated, totalVotingPower, getLedger(accountId), currentCycle);
    }

    /**
     * Drop the cached ledger and re-read it from the store.
     */
    public List<DelegationRecord> refresh(String accountId) {
        String account = AccountIds.normalize(accountId);
        evict(account);
        return getLedger(account);
    }

    /**
     * Irreversibly delete the account's ledger. Only for explicit user-initiated resets.
     * Holds the account's writer lock, so a reconcile in flight finishes before the clear.
     *
     * @return number of records removed
     */
    public long reset(String accountId) {
        String account = AccountIds.normalize(accountId);
        ReentrantLock lock = accountLocks.lockFor(account);
        long removed;
        lock.lock();
        try {
            removed = ledgerStore.clear(account);
        } finally {
            evict(account);
            lock.unlock();
        }
        log.info("Ledger reset for {}: {} records removed", account, removed);
        applicationEventPublisher.publishEvent(new LedgerResetEvent(account, removed));
        return removed;
    }

    void evict(String accountId) {
        Cache cache = cacheManager.getCache(CaffeineConfig.LEDGER_CACHE);
        if (cache != null) {
            cache.evict(accountId);
            log.debug("Evicted cached ledger for {}", accountId);
        }
    }

    private List<DelegationRecord> load(String accountId) {
        return List.copyOf(ledgerStore.getAll(accountId));
    }
}

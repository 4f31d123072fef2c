package com.evermark.common;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * One writer lock per account. Values are weakly held: a lock stays mapped while any thread holds or waits on it,
 * and an unreferenced lock is free anyway, so replacing it with a new instance is equivalent.
 * Shared by every writer of an account's ledger: reconciles and resets.
 */
@Component
public class AccountLocks {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(accountId -> new ReentrantLock());

    public ReentrantLock lockFor(String accountId) {
        return locks.get(accountId);
    }
}

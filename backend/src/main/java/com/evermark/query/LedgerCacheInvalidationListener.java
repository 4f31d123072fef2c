package com.evermark.query;

import com.evermark.domain.LedgerChangedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Evicts an account's cached ledger when the reconciler appends to it. Runs synchronously on the reconciling
 * thread, so the next read after reconcile returns sees the new records.
 */
@Component
@RequiredArgsConstructor
public class LedgerCacheInvalidationListener {

    private final DelegationQueryService delegationQueryService;

    @EventListener
    public void onLedgerChanged(LedgerChangedEvent event) {
        delegationQueryService.evict(event.accountId());
    }
}

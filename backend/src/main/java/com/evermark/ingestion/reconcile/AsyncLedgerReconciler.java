package com.evermark.ingestion.reconcile;

import com.evermark.config.AsyncConfig;
import com.evermark.domain.DelegationEventsReceivedEvent;
import com.evermark.domain.RawDelegationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs reconciles on reconcile-executor: explicit async submissions (e.g. a backfill job) and batches handed over
 * by transports via {@link DelegationEventsReceivedEvent}. Failures of event-driven reconciles are logged as soft
 * warnings; a redelivery of the batch is absorbed by dedup.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AsyncLedgerReconciler {

    private final LedgerReconciler ledgerReconciler;

    @Async(AsyncConfig.RECONCILE_EXECUTOR)
    public CompletableFuture<ReconcileSummary> reconcileAsync(String accountId, List<RawDelegationEvent> events) {
        try {
            return CompletableFuture.completedFuture(ledgerReconciler.reconcile(accountId, events));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Async(AsyncConfig.RECONCILE_EXECUTOR)
    @EventListener
    public void onDelegationEventsReceived(DelegationEventsReceivedEvent event) {
        if (event.accountId() == null || event.accountId().isBlank()
                || event.events() == null || event.events().isEmpty()) {
            return;
        }
        try {
            ReconcileSummary summary = ledgerReconciler.reconcile(event.accountId(), event.events());
            if (summary.hasWarnings()) {
                log.warn("Pushed batch for {}: {} events rejected", summary.accountId(), summary.rejected());
            }
        } catch (ReconcileException e) {
            log.warn("Pushed batch for {} failed with {} after {} inserts: {}",
                    event.accountId(), e.getErrorCode(), e.getSummary().inserted(), e.getMessage());
        }
    }
}

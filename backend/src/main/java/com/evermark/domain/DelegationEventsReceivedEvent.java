package com.evermark.domain;

import java.util.List;

/**
 * Application event: a transport (subscription, webhook, poller) handed over a batch of raw delegation events for
 * an account. Consumed asynchronously by the reconciler.
 */
public record DelegationEventsReceivedEvent(String accountId, List<RawDelegationEvent> events) {
}

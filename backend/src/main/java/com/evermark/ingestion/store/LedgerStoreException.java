package com.evermark.ingestion.store;

import lombok.Getter;

/**
 * Thrown by a {@link LedgerStore} when persistence fails. Records confirmed before the failure stay durable;
 * {@code insertedBeforeFailure} reports how many of the failed call's records that covers.
 */
@Getter
public class LedgerStoreException extends RuntimeException {

    private final String accountId;
    private final int insertedBeforeFailure;

    public LedgerStoreException(String accountId, int insertedBeforeFailure, String message, Throwable cause) {
        super(message, cause);
        this.accountId = accountId;
        this.insertedBeforeFailure = insertedBeforeFailure;
    }
}

package com.evermark.ingestion.reconcile;

import lombok.Getter;

/**
 * Single aggregate failure of a reconcile call. {@code summary} is the partial progress: records counted as
 * inserted there are durable and are not rolled back; retrying the same batch absorbs them as duplicates.
 */
@Getter
public class ReconcileException extends RuntimeException {

    public static final String STORE_FAILURE = "STORE_FAILURE";
    public static final String CANCELLED = "CANCELLED";
    public static final String LOCK_TIMEOUT = "LOCK_TIMEOUT";

    /** One of STORE_FAILURE, CANCELLED, LOCK_TIMEOUT. */
    private final String errorCode;
    private final ReconcileSummary summary;

    public ReconcileException(String errorCode, ReconcileSummary summary, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.summary = summary;
    }

    public ReconcileException(String errorCode, ReconcileSummary summary, String message) {
        this(errorCode, summary, message, null);
    }
}

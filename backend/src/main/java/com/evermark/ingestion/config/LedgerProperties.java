package com.evermark.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Ledger ingestion config: write batching, per-account lock wait, reconcile deadline and source event id policy.
 */
@ConfigurationProperties(prefix = "evermark.ledger")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** Maximum records per bulk insert; bursts (backfills) are written in chunks of this size. */
    @Positive
    private int writeBatchSize = 500;

    /** How long a reconcile waits for the account's writer lock before failing with LOCK_TIMEOUT. */
    @NotNull
    private Duration lockTimeout = Duration.ofSeconds(30);

    /** Deadline applied when the caller does not pass one. */
    @NotNull
    private Duration defaultReconcileTimeout = Duration.ofMinutes(2);

    /** Upper bound for synthesized source event ids (prefix plus digest, digest cut to fit). */
    @Min(42)
    private int sourceEventIdMaxLength = 128;

    /** What to do with an event that carries no transaction hash. */
    @NotNull
    private MissingHashPolicy missingHashPolicy = MissingHashPolicy.SYNTHESIZE;

    public enum MissingHashPolicy {
        /** Build a composite key from the event fields; identical same-shaped events collapse into one. */
        SYNTHESIZE,
        /** Reject the event as malformed. */
        REJECT
    }
}

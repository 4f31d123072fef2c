package com.evermark.domain;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable delegation fact for one account. {@code sourceEventId} is the dedup key within the account's ledger;
 * {@code cycle} is contract-assigned and never recomputed locally. Amounts are in the token's smallest unit and
 * serialize as strings.
 */
public record DelegationRecord(
        String accountId,
        String itemId,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger amount,
        long cycle,
        DelegationDirection direction,
        Instant observedAt,
        String sourceEventId
) {

    public DelegationRecord {
        requireText(accountId, "accountId");
        requireText(itemId, "itemId");
        requireText(sourceEventId, "sourceEventId");
        Objects.requireNonNull(amount, "amount must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(observedAt, "observedAt must not be null");
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive, got: " + amount);
        }
        if (cycle < 0) {
            throw new IllegalArgumentException("cycle must be non-negative, got: " + cycle);
        }
    }

    /** +amount for DELEGATE, -amount for UNDELEGATE. */
    public BigInteger signedAmount() {
        return direction.signed(amount);
    }

    public boolean isDelegate() {
        return direction == DelegationDirection.DELEGATE;
    }

    private static void requireText(String value, String field) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}

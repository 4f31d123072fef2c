package com.evermark.domain;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Direction of a delegation event. Raw values are accepted as the plain direction names (any case) or as the
 * voting contract's event names.
 */
public enum DelegationDirection {

    DELEGATE("VoteDelegated"),
    UNDELEGATE("VoteUndelegated");

    private final String contractEventName;

    DelegationDirection(String contractEventName) {
        this.contractEventName = contractEventName;
    }

    public String getContractEventName() {
        return contractEventName;
    }

    /** Applies this direction's sign to an unsigned amount. */
    public BigInteger signed(BigInteger amount) {
        return this == DELEGATE ? amount : amount.negate();
    }

    public static Optional<DelegationDirection> fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (DelegationDirection direction : values()) {
            if (direction.name().equalsIgnoreCase(value) || direction.contractEventName.equalsIgnoreCase(value)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }
}

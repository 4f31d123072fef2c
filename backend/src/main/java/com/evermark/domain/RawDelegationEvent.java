package com.evermark.domain;

import java.math.BigInteger;

/**
 * Delegate/undelegate notification as delivered by the chain client or event subscription. Any field may be null
 * for malformed upstream data. {@code blockTimestamp} is Unix epoch seconds; {@code logIndex} is optional and
 * distinguishes several delegation events emitted by one transaction.
 */
public record RawDelegationEvent(
        String account,
        String itemId,
        BigInteger amount,
        Long cycle,
        String direction,
        String txHash,
        Long blockTimestamp,
        Integer logIndex
) {

    public static RawDelegationEvent of(String account, String itemId, BigInteger amount, Long cycle,
                                        String direction, String txHash, Long blockTimestamp) {
        return new RawDelegationEvent(account, itemId, amount, cycle, direction, txHash, blockTimestamp, null);
    }
}

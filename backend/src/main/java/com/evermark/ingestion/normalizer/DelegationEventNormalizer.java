package com.evermark.ingestion.normalizer;

import com.evermark.common.AccountIds;
import com.evermark.domain.DelegationDirection;
import com.evermark.domain.DelegationRecord;
import com.evermark.domain.RawDelegationEvent;
import com.evermark.ingestion.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

/**
 * Converts raw delegate/undelegate notifications to canonical {@link DelegationRecord}s.
 * sourceEventId is the transaction hash (suffixed with ":logIndex" when the log index is known); without a hash
 * it is synthesized as a SHA-256 digest of (account, itemId, amount, cycle, direction) or the event is rejected, per
 * {@link LedgerProperties#getMissingHashPolicy()}. Rejections are returned, never thrown.
 */
@Component
@RequiredArgsConstructor
public class DelegationEventNormalizer {

    static final String SYNTHETIC_PREFIX = "synthetic:";

    private final LedgerProperties properties;

    public NormalizationResult normalize(RawDelegationEvent raw) {
        return normalize(null, raw);
    }

    /**
     * Normalize one raw event.
     *
     * @param expectedAccountId canonical account the batch belongs to; null accepts any account
     * @param raw               raw event, fields may be null
     * @return accepted record or rejection reason
     */
    public NormalizationResult normalize(String expectedAccountId, RawDelegationEvent raw) {
        if (raw == null) {
            return NormalizationResult.rejected(RejectionReason.EMPTY_EVENT);
        }
        String account = AccountIds.normalizeOrNull(raw.account());
        if (account == null) {
            return NormalizationResult.rejected(RejectionReason.MISSING_ACCOUNT);
        }
        if (expectedAccountId != null && !expectedAccountId.equals(account)) {
            return NormalizationResult.rejected(RejectionReason.ACCOUNT_MISMATCH);
        }
        BigInteger amount = raw.amount();
        if (amount == null || amount.signum() <= 0) {
            return NormalizationResult.rejected(RejectionReason.NON_POSITIVE_AMOUNT);
        }
        Optional<DelegationDirection> direction = DelegationDirection.fromRaw(raw.direction());
        if (direction.isEmpty()) {
            return NormalizationResult.rejected(RejectionReason.INVALID_DIRECTION);
        }
        if (raw.itemId() == null || raw.itemId().isBlank()) {
            return NormalizationResult.rejected(RejectionReason.MISSING_ITEM);
        }
        if (raw.cycle() == null || raw.cycle() < 0) {
            return NormalizationResult.rejected(RejectionReason.INVALID_CYCLE);
        }
        String itemId = raw.itemId().trim();
        String sourceEventId = sourceEventId(raw, account, itemId, amount, direction.get());
        if (sourceEventId == null) {
            return NormalizationResult.rejected(RejectionReason.MISSING_TX_HASH);
        }
        return NormalizationResult.accepted(new DelegationRecord(
                account,
                itemId,
                amount,
                raw.cycle(),
                direction.get(),
                observedAt(raw.blockTimestamp()),
                sourceEventId));
    }

    private String sourceEventId(RawDelegationEvent raw, String account, String itemId, BigInteger amount,
                                 DelegationDirection direction) {
        if (raw.txHash() != null && !raw.txHash().isBlank()) {
            String hash = raw.txHash().trim().toLowerCase(Locale.ROOT);
            return raw.logIndex() != null ? hash + ":" + raw.logIndex() : hash;
        }
        if (properties.getMissingHashPolicy() == LedgerProperties.MissingHashPolicy.REJECT) {
            return null;
        }
        String fields = String.join("|",
                account, itemId, amount.toString(), Long.toString(raw.cycle()), direction.name());
        String digest = sha256Hex(fields);
        int digestLength = Math.min(digest.length(), properties.getSourceEventIdMaxLength() - SYNTHETIC_PREFIX.length());
        return SYNTHETIC_PREFIX + digest.substring(0, digestLength);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static Instant observedAt(Long blockTimestamp) {
        return blockTimestamp != null ? Instant.ofEpochSecond(blockTimestamp) : Instant.now();
    }
}

package com.evermark.ingestion.normalizer;

import com.evermark.domain.DelegationDirection;
import com.evermark.domain.DelegationRecord;
import com.evermark.domain.RawDelegationEvent;
import com.evermark.ingestion.config.LedgerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DelegationEventNormalizerTest {

    private static final String ACCOUNT = "0x00000000000000000000000000000000000000aa";

    private LedgerProperties properties;
    private DelegationEventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
        normalizer = new DelegationEventNormalizer(properties);
    }

    @Test
    @DisplayName("well-formed event becomes a record keyed by its lower-cased tx hash")
    void acceptsWellFormedEvent() {
        RawDelegationEvent raw = RawDelegationEvent.of(ACCOUNT.toUpperCase().replace("0X", "0x"), " 42 ",
                BigInteger.valueOf(100), 3L, "VoteDelegated", "0xABC", 1_700_000_000L);

        NormalizationResult result = normalizer.normalize(ACCOUNT, raw);

        assertThat(result.isAccepted()).isTrue();
        DelegationRecord record = result.record();
        assertThat(record.accountId()).isEqualTo(ACCOUNT);
        assertThat(record.itemId()).isEqualTo("42");
        assertThat(record.amount()).isEqualTo(BigInteger.valueOf(100));
        assertThat(record.cycle()).isEqualTo(3);
        assertThat(record.direction()).isEqualTo(DelegationDirection.DELEGATE);
        assertThat(record.sourceEventId()).isEqualTo("0xabc");
        assertThat(record.observedAt()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
    }

    @Test
    @DisplayName("log index is appended to the hash so events of one tx stay distinct")
    void logIndexSuffix() {
        RawDelegationEvent raw = new RawDelegationEvent(ACCOUNT, "1", BigInteger.ONE, 0L, "Delegate",
                "0xabc", 1L, 5);

        assertThat(normalizer.normalize(raw).record().sourceEventId()).isEqualTo("0xabc:5");
    }

    @Test
    @DisplayName("missing hash synthesizes a digest key, identical for identical events")
    void synthesizesKeyWithoutHash() {
        RawDelegationEvent first = RawDelegationEvent.of(ACCOUNT, "7", BigInteger.TEN, 2L, "Undelegate", null, null);
        RawDelegationEvent second = RawDelegationEvent.of(ACCOUNT, "7", BigInteger.TEN, 2L, "undelegate", " ", 99L);

        String firstId = normalizer.normalize(first).record().sourceEventId();
        String secondId = normalizer.normalize(second).record().sourceEventId();

        assertThat(firstId).startsWith(DelegationEventNormalizer.SYNTHETIC_PREFIX).isEqualTo(secondId);
        assertThat(firstId).hasSize(DelegationEventNormalizer.SYNTHETIC_PREFIX.length() + 64)
                .matches("synthetic:[0-9a-f]{64}");
        assertThat(normalizer.normalize(first).record().observedAt()).isNotNull();
    }

    @Test
    @DisplayName("synthesized key is cut to the configured bound")
    void synthesizedKeyBounded() {
        properties.setSourceEventIdMaxLength(42);
        RawDelegationEvent raw = RawDelegationEvent.of(ACCOUNT, "item-with-a-long-identifier",
                new BigInteger("123456789012345678901234567890"), 2L, "Delegate", null, null);

        assertThat(normalizer.normalize(raw).record().sourceEventId()).hasSize(42);
    }

    @Test
    @DisplayName("long item ids do not make different hash-less events share a key")
    void longItemIdKeepsEventsDistinct() {
        String itemId = "ipfs://bafybeigdyrzt5sfp7udm7hu76uh7y26nf3efuylqabf3oclgtqy55fbzdi/evermark-metadata.json";
        RawDelegationEvent delegate = RawDelegationEvent.of(ACCOUNT, itemId, BigInteger.valueOf(100), 1L,
                "Delegate", null, null);
        RawDelegationEvent undelegate = RawDelegationEvent.of(ACCOUNT, itemId, BigInteger.valueOf(100), 1L,
                "Undelegate", null, null);
        RawDelegationEvent laterDelegate = RawDelegationEvent.of(ACCOUNT, itemId, BigInteger.valueOf(7), 9L,
                "Delegate", null, null);

        List<String> ids = List.of(
                normalizer.normalize(delegate).record().sourceEventId(),
                normalizer.normalize(undelegate).record().sourceEventId(),
                normalizer.normalize(laterDelegate).record().sourceEventId());

        assertThat(ids).doesNotHaveDuplicates()
                .allSatisfy(id -> assertThat(id.length()).isLessThanOrEqualTo(properties.getSourceEventIdMaxLength()));
    }

    @Test
    @DisplayName("REJECT policy rejects hash-less events")
    void rejectPolicy() {
        properties.setMissingHashPolicy(LedgerProperties.MissingHashPolicy.REJECT);
        RawDelegationEvent raw = RawDelegationEvent.of(ACCOUNT, "7", BigInteger.TEN, 2L, "Delegate", null, null);

        assertThat(normalizer.normalize(raw).rejection()).isEqualTo(RejectionReason.MISSING_TX_HASH);
    }

    @Test
    void rejectsMalformedEvents() {
        assertThat(normalizer.normalize(null).rejection()).isEqualTo(RejectionReason.EMPTY_EVENT);
        assertThat(reject(RawDelegationEvent.of(null, "1", BigInteger.ONE, 1L, "Delegate", "0x1", 1L)))
                .isEqualTo(RejectionReason.MISSING_ACCOUNT);
        assertThat(reject(RawDelegationEvent.of(ACCOUNT, "1", BigInteger.ZERO, 1L, "Delegate", "0x1", 1L)))
                .isEqualTo(RejectionReason.NON_POSITIVE_AMOUNT);
        assertThat(reject(RawDelegationEvent.of(ACCOUNT, "1", BigInteger.valueOf(-5), 1L, "Delegate", "0x1", 1L)))
                .isEqualTo(RejectionReason.NON_POSITIVE_AMOUNT);
        assertThat(reject(RawDelegationEvent.of(ACCOUNT, "1", null, 1L, "Delegate", "0x1", 1L)))
                .isEqualTo(RejectionReason.NON_POSITIVE_AMOUNT);
        assertThat(reject(RawDelegationEvent.of(ACCOUNT, "1", BigInteger.ONE, 1L, "Transfer", "0x1", 1L)))
                .isEqualTo(RejectionReason.INVALID_DIRECTION);
        assertThat(reject(RawDelegationEvent.of(ACCOUNT, null, BigInteger.ONE, 1L, "Delegate", "0x1", 1L)))
                .isEqualTo(RejectionReason.MISSING_ITEM);
        assertThat(reject(RawDelegationEvent.of(ACCOUNT, "1", BigInteger.ONE, null, "Delegate", "0x1", 1L)))
                .isEqualTo(RejectionReason.INVALID_CYCLE);
        assertThat(reject(RawDelegationEvent.of(ACCOUNT, "1", BigInteger.ONE, -1L, "Delegate", "0x1", 1L)))
                .isEqualTo(RejectionReason.INVALID_CYCLE);
    }

    @Test
    @DisplayName("event for another account is rejected when an account is expected")
    void accountMismatch() {
        RawDelegationEvent raw = RawDelegationEvent.of("0xbb", "1", BigInteger.ONE, 1L, "Delegate", "0x1", 1L);

        assertThat(normalizer.normalize(ACCOUNT, raw).rejection()).isEqualTo(RejectionReason.ACCOUNT_MISMATCH);
        assertThat(normalizer.normalize(raw).isAccepted()).isTrue();
    }

    private RejectionReason reject(RawDelegationEvent raw) {
        NormalizationResult result = normalizer.normalize(ACCOUNT, raw);
        assertThat(result.isAccepted()).isFalse();
        return result.rejection();
    }
}

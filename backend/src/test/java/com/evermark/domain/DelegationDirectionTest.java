package com.evermark.domain;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class DelegationDirectionTest {

    @ParameterizedTest
    @ValueSource(strings = {"Delegate", "DELEGATE", " delegate ", "VoteDelegated"})
    void parsesDelegate(String raw) {
        assertThat(DelegationDirection.fromRaw(raw)).contains(DelegationDirection.DELEGATE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Undelegate", "UNDELEGATE", "voteundelegated"})
    void parsesUndelegate(String raw) {
        assertThat(DelegationDirection.fromRaw(raw)).contains(DelegationDirection.UNDELEGATE);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"stake", "NewVotingCycle", "delegated"})
    void rejectsOthers(String raw) {
        assertThat(DelegationDirection.fromRaw(raw)).isEmpty();
    }
}

package com.latticeMarket.latticeLedger.token.service;

import com.latticeMarket.latticeLedger.token.model.TokenId;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class OwnershipIndexTest {

    private final OwnershipIndex index = new OwnershipIndex(3);

    @Test
    void keepsAcquisitionOrder() {
        index.add("alice", TokenId.of(2, 1));
        index.add("alice", TokenId.of(1, 5));
        index.add("alice", TokenId.of(1, 2));

        assertThat(index.tokensOf("alice")).containsExactly(TokenId.of(2, 1), TokenId.of(1, 5), TokenId.of(1, 2));
        assertThat(index.count("alice")).isEqualTo(3);
    }

    @Test
    void removesByValue() {
        index.add("alice", TokenId.of(1, 1));
        index.add("alice", TokenId.of(1, 2));
        index.add("alice", TokenId.of(1, 3));

        index.remove("alice", TokenId.of(1, 2));

        assertThat(index.tokensOf("alice")).containsExactly(TokenId.of(1, 1), TokenId.of(1, 3));
        assertThat(index.contains("alice", TokenId.of(1, 2))).isFalse();
    }

    @Test
    void rejectsDuplicates() {
        index.add("alice", TokenId.of(1, 1));

        assertThatThrownBy(() -> index.add("alice", TokenId.of(1, 1))).isInstanceOf(IllegalStateException.class);
        assertThat(index.tokensOf("alice")).containsExactly(TokenId.of(1, 1));
    }

    @Test
    void rejectsRemovalOfUnlistedToken() {
        index.add("alice", TokenId.of(1, 1));

        assertThatThrownBy(() -> index.remove("bob", TokenId.of(1, 1))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> index.remove("alice", TokenId.of(1, 2))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void enforcesThePerAccountCap() {
        index.add("alice", TokenId.of(1, 1));
        index.add("alice", TokenId.of(1, 2));
        assertThat(index.hasCapacity("alice")).isTrue();
        index.add("alice", TokenId.of(1, 3));

        assertThat(index.hasCapacity("alice")).isFalse();
        assertThatThrownBy(() -> index.add("alice", TokenId.of(1, 4))).isInstanceOf(IllegalStateException.class);
        assertThat(index.hasCapacity("bob")).isTrue();
    }

    @Test
    void unknownAccountOwnsNothing() {
        assertThat(index.tokensOf("nobody")).isEmpty();
        assertThat(index.count("nobody")).isZero();
    }

    @Test
    void returnedListIsASnapshot() {
        index.add("alice", TokenId.of(1, 1));
        var snapshot = index.tokensOf("alice");

        index.add("alice", TokenId.of(1, 2));

        assertThat(snapshot).containsExactly(TokenId.of(1, 1));
    }
}

package com.keyregistry.groups.model;

import com.keyregistry.groups.exception.InvalidKeyException;
import com.keyregistry.groups.util.RegistryKeyFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.keyregistry.groups.util.TestConstants.*;
import static org.assertj.core.api.Assertions.*;

class GroupTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Test
    void constructor_CountsOwnerAndDerivesAddress() {
        // When
        Group group = new Group(GROUP_ID.toUpperCase(), OWNER_ID, "Book Club", null, NOW);

        // Then
        assertThat(group.getGroupId()).isEqualTo(GROUP_ID);
        assertThat(group.getMemberCount()).isEqualTo(1);
        assertThat(group.getDescription()).isEmpty();
        assertThat(group.getPk()).isEqualTo("GROUP#" + GROUP_ID);
        assertThat(group.getSk()).isEqualTo("METADATA");
        assertThat(group.getAddressProof()).isEqualTo(RegistryKeyFactory.groupAddress(GROUP_ID).getProof());
        assertThat(group.isEnableReplies()).isTrue();
        assertThat(group.isEnableTypingIndicators()).isTrue();
        assertThat(group.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void constructor_WithBadId_ThrowsInvalidKey() {
        assertThatThrownBy(() -> new Group("not-hex", OWNER_ID, "Name", "", NOW))
            .isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void refreshDiscoverability_IndexesOnlyPublicSearchableGroups() {
        // Given
        Group group = new Group(GROUP_ID, OWNER_ID, "Book Club", "", NOW);
        group.setPublic(true);

        // When / Then
        group.refreshDiscoverability();
        assertThat(group.getGsi2pk()).isNull();

        group.setSearchable(true);
        group.refreshDiscoverability();
        assertThat(group.getGsi2pk()).isEqualTo("PUBLIC_GROUPS");
        assertThat(group.getGsi2sk()).isEqualTo("GROUP#" + GROUP_ID);

        group.setPublic(false);
        group.refreshDiscoverability();
        assertThat(group.getGsi2pk()).isNull();
    }

    @Test
    void hasCapacity_TreatsZeroAsUnlimited() {
        Group group = new Group(GROUP_ID, OWNER_ID, "Book Club", "", NOW);
        group.setMemberCount(1000);

        assertThat(group.hasCapacity()).isTrue();

        group.setMaxMembers(1000);
        assertThat(group.hasCapacity()).isFalse();
    }

    @Test
    void decrementMemberCount_SaturatesAtZero() {
        Group group = new Group(GROUP_ID, OWNER_ID, "Book Club", "", NOW);
        group.setMemberCount(0);

        group.decrementMemberCount();

        assertThat(group.getMemberCount()).isZero();
    }

    @Test
    void isOwnedBy_ComparesOwnerIdentity() {
        Group group = new Group(GROUP_ID, OWNER_ID, "Book Club", "", NOW);

        assertThat(group.isOwnedBy(OWNER_ID)).isTrue();
        assertThat(group.isOwnedBy(MEMBER_ID)).isFalse();
        assertThat(group.isOwnedBy(null)).isFalse();
    }
}

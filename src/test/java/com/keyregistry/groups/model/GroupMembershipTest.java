package com.keyregistry.groups.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.keyregistry.groups.util.TestConstants.*;
import static org.assertj.core.api.Assertions.*;

class GroupMembershipTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Test
    void constructor_SetsRoleMaskAndIndexKeys() {
        // When
        GroupMembership membership = new GroupMembership(GROUP_ID, MEMBER_ID, GroupRole.MODERATOR,
            memberKey(), OWNER_ID, NOW);

        // Then
        assertThat(membership.getPermissions()).isEqualTo(GroupRole.MODERATOR.getPermissions());
        assertThat(membership.isActive()).isTrue();
        assertThat(membership.getJoinedAt()).isEqualTo(NOW);
        assertThat(membership.getSk()).isEqualTo("MEMBER#" + MEMBER_ID);
        assertThat(membership.getGsi1pk()).isEqualTo("MEMBER#" + MEMBER_ID);
        assertThat(membership.getGsi1sk()).isEqualTo("GROUP#" + GROUP_ID);
    }

    @Test
    void applyRole_ResetsPermissionsToRoleMask() {
        // Given
        GroupMembership membership = new GroupMembership(GROUP_ID, MEMBER_ID, GroupRole.MEMBER,
            memberKey(), OWNER_ID, NOW);
        membership.setPermissions(0xFFFF);

        // When
        membership.applyRole(GroupRole.ADMIN);

        // Then
        assertThat(membership.getRole()).isEqualTo(GroupRole.ADMIN);
        assertThat(membership.getPermissions()).isEqualTo(GroupRole.ADMIN.getPermissions());
        assertThat(membership.hasPermission(Permission.MANAGE_ROLES)).isTrue();
        assertThat(membership.hasPermission(Permission.DELETE_MESSAGES)).isFalse();
    }

    @Test
    void isOwner_OnlyForOwnerRole() {
        GroupMembership owner = new GroupMembership(GROUP_ID, OWNER_ID, GroupRole.OWNER, new byte[64], OWNER_ID, NOW);
        GroupMembership admin = new GroupMembership(GROUP_ID, ADMIN_ID, GroupRole.ADMIN, memberKey(), OWNER_ID, NOW);

        assertThat(owner.isOwner()).isTrue();
        assertThat(admin.isOwner()).isFalse();
    }
}

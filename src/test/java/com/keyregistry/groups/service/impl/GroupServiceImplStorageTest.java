package com.keyregistry.groups.service.impl;

import com.keyregistry.groups.dto.CreateGroupRequest;
import com.keyregistry.groups.exception.AlreadyExistsException;
import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.GroupRole;
import org.junit.jupiter.api.Test;

import static com.keyregistry.groups.util.TestConstants.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Group lifecycle against the in-memory store, where occupied addresses are really rejected.
 */
class GroupServiceImplStorageTest extends InMemoryRegistryTestSupport {

    @Test
    void createGroup_ReusedGroupId_FailsAndLeavesFirstGroupUntouched() {
        // Given
        createGroup();
        joinAs(MEMBER_ID);
        CreateGroupRequest duplicate = new CreateGroupRequest(GROUP_ID, "Chess Club", groupKey());

        // When / Then
        assertThatThrownBy(() -> groupService.createGroup(duplicate, OUTSIDER_ID))
            .isInstanceOf(AlreadyExistsException.class);

        Group stored = repository.findGroup(GROUP_ID).orElseThrow();
        assertThat(stored.getName()).isEqualTo("Book Club");
        assertThat(stored.getOwnerId()).isEqualTo(OWNER_ID);
        assertThat(stored.getMemberCount()).isEqualTo(2);
        assertThat(repository.findMembership(GROUP_ID, OUTSIDER_ID)).isEmpty();
        assertThat(repository.findMembership(GROUP_ID, OWNER_ID))
            .map(GroupMembership::getRole).contains(GroupRole.OWNER);
    }

    @Test
    void createGroup_SameCreatorTwice_KeepsSingleOwnerMembership() {
        createGroup();

        assertThatThrownBy(this::createGroup).isInstanceOf(AlreadyExistsException.class);

        assertThat(repository.findMembersByGroupId(GROUP_ID)).hasSize(1);
        assertThat(memberCount()).isEqualTo(1);
    }
}

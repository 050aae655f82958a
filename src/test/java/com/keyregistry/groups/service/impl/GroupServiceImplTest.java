package com.keyregistry.groups.service.impl;

import com.keyregistry.groups.dto.CreateGroupRequest;
import com.keyregistry.groups.dto.GroupDTO;
import com.keyregistry.groups.dto.UpdateGroupRequest;
import com.keyregistry.groups.exception.InvalidStateException;
import com.keyregistry.groups.exception.PermissionDeniedException;
import com.keyregistry.groups.exception.ResourceNotFoundException;
import com.keyregistry.groups.exception.ValidationException;
import com.keyregistry.groups.model.CodeLookup;
import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.GroupRole;
import com.keyregistry.groups.repository.GroupRepository;
import com.keyregistry.groups.repository.RecordMutation;
import com.keyregistry.groups.repository.RegistryTransaction;
import com.keyregistry.groups.service.GroupAuditLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.keyregistry.groups.util.TestConstants.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GroupServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Mock
    private GroupRepository groupRepository;

    @Mock
    private GroupAuditLogger auditLogger;

    private GroupServiceImpl groupService;

    @BeforeEach
    void setUp() {
        groupService = new GroupServiceImpl(groupRepository, new GroupAuthorizationPolicyImpl(), auditLogger,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Group existingGroup() {
        Group group = new Group(GROUP_ID, OWNER_ID, "Book Club", "Monthly reads", NOW.minusSeconds(3600));
        group.setVersion(3L);
        return group;
    }

    private GroupMembership membership(String id, GroupRole role) {
        GroupMembership membership = new GroupMembership(GROUP_ID, id, role, memberKey(), OWNER_ID, NOW);
        membership.setVersion(1L);
        return membership;
    }

    private RegistryTransaction capturedTransaction() {
        ArgumentCaptor<RegistryTransaction> captor = ArgumentCaptor.forClass(RegistryTransaction.class);
        verify(groupRepository).commit(captor.capture());
        return captor.getValue();
    }

    @Nested
    class CreateGroup {

        @Test
        void createGroup_WithValidRequest_CreatesGroupAndOwnerTogether() {
            // Given
            CreateGroupRequest request = new CreateGroupRequest(GROUP_ID, "Book Club", groupKey());

            // When
            GroupDTO result = groupService.createGroup(request, OWNER_ID);

            // Then
            RegistryTransaction transaction = capturedTransaction();
            assertThat(transaction.getMutations()).hasSize(2)
                .allMatch(mutation -> mutation.getType() == RecordMutation.Type.CREATE);
            assertThat(transaction.getMutations().get(0).getItem()).isInstanceOf(Group.class);

            GroupMembership owner = (GroupMembership) transaction.getMutations().get(1).getItem();
            assertThat(owner.getRole()).isEqualTo(GroupRole.OWNER);
            assertThat(owner.getEncryptedGroupKey()).hasSize(64).containsOnly((byte) 0);

            assertThat(result.getMemberCount()).isEqualTo(1);
            assertThat(result.getUserRole()).isEqualTo(GroupRole.OWNER);
            assertThat(result.getGroupEncryptionKey()).isEqualTo(groupKey());
            verify(auditLogger).logGroupCreated(eq(OWNER_ID), any(Group.class));
        }

        @Test
        void createGroup_AppliesFlagDefaults() {
            // When
            GroupDTO result = groupService.createGroup(new CreateGroupRequest(GROUP_ID, "Book Club", groupKey()), OWNER_ID);

            // Then
            assertThat(result.isPublic()).isFalse();
            assertThat(result.isInviteOnly()).isFalse();
            assertThat(result.isAllowMemberInvites()).isFalse();
            assertThat(result.isEnableReplies()).isTrue();
            assertThat(result.isEnableReactions()).isTrue();
            assertThat(result.isEnableReadReceipts()).isTrue();
            assertThat(result.isEnableTypingIndicators()).isTrue();
            assertThat(result.getMaxMembers()).isZero();
        }

        @Test
        void createGroup_PublicSearchable_IsIndexedForDiscovery() {
            // Given
            CreateGroupRequest request = new CreateGroupRequest(GROUP_ID, "Book Club", groupKey());
            request.setPublic(true);
            request.setSearchable(true);

            // When
            groupService.createGroup(request, OWNER_ID);

            // Then
            Group created = (Group) capturedTransaction().getMutations().get(0).getItem();
            assertThat(created.getGsi2pk()).isEqualTo("PUBLIC_GROUPS");
        }

        @Test
        void createGroup_WithWrongKeyLength_FailsWithoutWriting() {
            CreateGroupRequest request = new CreateGroupRequest(GROUP_ID, "Book Club", new byte[16]);

            assertThatThrownBy(() -> groupService.createGroup(request, OWNER_ID))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("groupEncryptionKey");
            verify(groupRepository, never()).commit(any());
        }

        @Test
        void createGroup_WithOverlongName_FailsWithoutWriting() {
            CreateGroupRequest request = new CreateGroupRequest(GROUP_ID, "n".repeat(101), groupKey());

            assertThatThrownBy(() -> groupService.createGroup(request, OWNER_ID))
                .isInstanceOf(ValidationException.class);
            verify(groupRepository, never()).commit(any());
        }
    }

    @Nested
    class SetGroupCode {

        @Test
        void setGroupCode_ByOwner_ClaimsLookupAndUpdatesGroup() {
            // Given
            Group group = existingGroup();
            when(groupRepository.findGroup(GROUP_ID)).thenReturn(Optional.of(group));
            when(groupRepository.findMembership(GROUP_ID, OWNER_ID))
                .thenReturn(Optional.of(membership(OWNER_ID, GroupRole.OWNER)));

            // When
            GroupDTO result = groupService.setGroupCode(GROUP_ID, "book-club", OWNER_ID);

            // Then
            RegistryTransaction transaction = capturedTransaction();
            RecordMutation lookup = transaction.getMutations().get(0);
            assertThat(lookup.getType()).isEqualTo(RecordMutation.Type.CREATE);
            assertThat(((CodeLookup) lookup.getItem()).getGroupId()).isEqualTo(GROUP_ID);

            RecordMutation groupUpdate = transaction.getMutations().get(1);
            assertThat(groupUpdate.getType()).isEqualTo(RecordMutation.Type.UPDATE);
            assertThat(groupUpdate.getExpectedVersion()).isEqualTo(3L);
            assertThat(result.getPublicCode()).isEqualTo("book-club");
        }

        @Test
        void setGroupCode_ByAdmin_IsDenied() {
            when(groupRepository.findGroup(GROUP_ID)).thenReturn(Optional.of(existingGroup()));

            assertThatThrownBy(() -> groupService.setGroupCode(GROUP_ID, "book-club", ADMIN_ID))
                .isInstanceOf(PermissionDeniedException.class)
                .extracting("reason").isEqualTo(PermissionDeniedException.Reason.NOT_GROUP_OWNER);
            verify(groupRepository, never()).commit(any());
        }

        @Test
        void setGroupCode_WithUppercase_FailsValidation() {
            assertThatThrownBy(() -> groupService.setGroupCode(GROUP_ID, "Book-Club", OWNER_ID))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("publicCode");
            verifyNoInteractions(groupRepository);
        }
    }

    @Nested
    class UpdateSettings {

        @Test
        void updateGroupSettings_WithNoFields_FailsValidation() {
            assertThatThrownBy(() -> groupService.updateGroupSettings(GROUP_ID, new UpdateGroupRequest(), OWNER_ID))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void updateGroupSettings_ByAdmin_AppliesOnlyProvidedFields() {
            // Given
            Group group = existingGroup();
            when(groupRepository.findGroup(GROUP_ID)).thenReturn(Optional.of(group));
            when(groupRepository.findMembership(GROUP_ID, ADMIN_ID))
                .thenReturn(Optional.of(membership(ADMIN_ID, GroupRole.ADMIN)));
            UpdateGroupRequest request = new UpdateGroupRequest();
            request.setName("Reading Circle");
            request.setPublic(true);
            request.setSearchable(true);

            // When
            GroupDTO result = groupService.updateGroupSettings(GROUP_ID, request, ADMIN_ID);

            // Then
            assertThat(result.getName()).isEqualTo("Reading Circle");
            assertThat(result.getDescription()).isEqualTo("Monthly reads");
            assertThat(result.getUpdatedAt()).isEqualTo(NOW);
            Group updated = (Group) capturedTransaction().getMutations().get(0).getItem();
            assertThat(updated.getGsi2pk()).isEqualTo("PUBLIC_GROUPS");
        }

        @Test
        void updateGroupSettings_ByModerator_IsDenied() {
            when(groupRepository.findGroup(GROUP_ID)).thenReturn(Optional.of(existingGroup()));
            when(groupRepository.findMembership(GROUP_ID, MODERATOR_ID))
                .thenReturn(Optional.of(membership(MODERATOR_ID, GroupRole.MODERATOR)));
            UpdateGroupRequest request = new UpdateGroupRequest();
            request.setInviteOnly(true);

            assertThatThrownBy(() -> groupService.updateGroupSettings(GROUP_ID, request, MODERATOR_ID))
                .isInstanceOf(PermissionDeniedException.class);
            verify(groupRepository, never()).commit(any());
        }

        @Test
        void updateGroupSettings_MaxMembersBelowCount_IsRefused() {
            // Given
            Group group = existingGroup();
            group.setMemberCount(5);
            when(groupRepository.findGroup(GROUP_ID)).thenReturn(Optional.of(group));
            when(groupRepository.findMembership(GROUP_ID, OWNER_ID))
                .thenReturn(Optional.of(membership(OWNER_ID, GroupRole.OWNER)));
            UpdateGroupRequest request = new UpdateGroupRequest();
            request.setMaxMembers(4);

            // When / Then
            assertThatThrownBy(() -> groupService.updateGroupSettings(GROUP_ID, request, OWNER_ID))
                .isInstanceOf(InvalidStateException.class)
                .extracting("reason").isEqualTo(InvalidStateException.Reason.MAX_MEMBERS_BELOW_COUNT);
        }

        @Test
        void updateGroupSettings_MaxMembersZero_IsAlwaysAllowed() {
            Group group = existingGroup();
            group.setMemberCount(5);
            group.setMaxMembers(5);
            when(groupRepository.findGroup(GROUP_ID)).thenReturn(Optional.of(group));
            when(groupRepository.findMembership(GROUP_ID, OWNER_ID))
                .thenReturn(Optional.of(membership(OWNER_ID, GroupRole.OWNER)));
            UpdateGroupRequest request = new UpdateGroupRequest();
            request.setMaxMembers(0);

            GroupDTO result = groupService.updateGroupSettings(GROUP_ID, request, OWNER_ID);

            assertThat(result.getMaxMembers()).isZero();
        }
    }

    @Nested
    class Reads {

        @Test
        void getGroup_PrivateGroupOutsider_IsDenied() {
            when(groupRepository.findGroup(GROUP_ID)).thenReturn(Optional.of(existingGroup()));
            when(groupRepository.findMembership(GROUP_ID, OUTSIDER_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> groupService.getGroup(GROUP_ID, OUTSIDER_ID))
                .isInstanceOf(PermissionDeniedException.class)
                .extracting("reason").isEqualTo(PermissionDeniedException.Reason.NOT_A_MEMBER);
        }

        @Test
        void getGroup_PublicGroupOutsider_SeesGroupWithoutKey() {
            Group group = existingGroup();
            group.setPublic(true);
            group.setGroupEncryptionKey(groupKey());
            when(groupRepository.findGroup(GROUP_ID)).thenReturn(Optional.of(group));
            when(groupRepository.findMembership(GROUP_ID, OUTSIDER_ID)).thenReturn(Optional.empty());

            GroupDTO result = groupService.getGroup(GROUP_ID, OUTSIDER_ID);

            assertThat(result.getGroupEncryptionKey()).isNull();
            assertThat(result.getUserRole()).isNull();
        }

        @Test
        void getGroup_Missing_ThrowsNotFound() {
            when(groupRepository.findGroup(GROUP_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> groupService.getGroup(GROUP_ID, OWNER_ID))
                .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        void getUserGroups_SkipsMembershipsOfMissingGroups() {
            // Given
            GroupMembership present = membership(MEMBER_ID, GroupRole.MEMBER);
            GroupMembership dangling = new GroupMembership(OTHER_GROUP_ID, MEMBER_ID, GroupRole.MEMBER,
                memberKey(), OWNER_ID, NOW);
            when(groupRepository.findGroupsByMemberId(MEMBER_ID)).thenReturn(List.of(present, dangling));
            when(groupRepository.findGroup(GROUP_ID)).thenReturn(Optional.of(existingGroup()));
            when(groupRepository.findGroup(OTHER_GROUP_ID)).thenReturn(Optional.empty());

            // When
            List<GroupDTO> groups = groupService.getUserGroups(MEMBER_ID);

            // Then
            assertThat(groups).extracting(GroupDTO::getGroupId).containsExactly(GROUP_ID);
        }

        @Test
        void searchPublicGroups_FiltersByNameIgnoringCaseAndSorts() {
            // Given
            Group zebra = publicGroup("1", "Zebra Readers");
            Group alpha = publicGroup("2", "alpha readers");
            Group chess = publicGroup("3", "Chess Club");
            when(groupRepository.findPublicGroups()).thenReturn(List.of(zebra, chess, alpha));

            // When
            List<GroupDTO> results = groupService.searchPublicGroups("READERS");

            // Then
            assertThat(results).extracting(GroupDTO::getName).containsExactly("alpha readers", "Zebra Readers");
            assertThat(results).allMatch(dto -> dto.getGroupEncryptionKey() == null);
        }

        private Group publicGroup(String suffix, String name) {
            String id = "0".repeat(64 - suffix.length()) + suffix;
            Group group = new Group(id, OWNER_ID, name, "", NOW);
            group.setPublic(true);
            group.setSearchable(true);
            group.setGroupEncryptionKey(groupKey());
            return group;
        }
    }
}

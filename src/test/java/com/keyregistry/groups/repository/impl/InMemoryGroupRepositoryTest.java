package com.keyregistry.groups.repository.impl;

import com.keyregistry.groups.exception.AlreadyExistsException;
import com.keyregistry.groups.exception.RepositoryException;
import com.keyregistry.groups.exception.VersionConflictException;
import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.GroupRole;
import com.keyregistry.groups.repository.RegistryTransaction;
import com.keyregistry.groups.util.QueryPerformanceTracker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.keyregistry.groups.util.TestConstants.*;
import static org.assertj.core.api.Assertions.*;

class InMemoryGroupRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private RegistryItemMapper mapper;
    private SimpleMeterRegistry meterRegistry;
    private InMemoryGroupRepository repository;

    @BeforeEach
    void setUp() {
        mapper = new RegistryItemMapper();
        meterRegistry = new SimpleMeterRegistry();
        repository = new InMemoryGroupRepository(mapper, new QueryPerformanceTracker(meterRegistry));
    }

    private Group group() {
        return new Group(GROUP_ID, OWNER_ID, "Book Club", "", NOW);
    }

    private GroupMembership membership(String memberId) {
        return new GroupMembership(GROUP_ID, memberId, GroupRole.MEMBER, memberKey(), OWNER_ID, NOW);
    }

    @Nested
    class Commit {

        @Test
        void commit_Create_AssignsFirstVersion() {
            // Given
            Group group = group();

            // When
            repository.commit(RegistryTransaction.begin("test").create(group));

            // Then
            assertThat(group.getVersion()).isEqualTo(1L);
            assertThat(repository.findGroup(GROUP_ID)).get()
                .extracting(Group::getVersion).isEqualTo(1L);
        }

        @Test
        void commit_CreateOverExisting_FailsWithAlreadyExists() {
            repository.commit(RegistryTransaction.begin("first").create(group()));

            assertThatThrownBy(() -> repository.commit(RegistryTransaction.begin("second").create(group())))
                .isInstanceOf(AlreadyExistsException.class);
        }

        @Test
        void commit_FailedCondition_AppliesNothing() {
            // Given
            repository.commit(RegistryTransaction.begin("seed").create(group()).create(membership(MEMBER_ID)));
            Group loaded = repository.findGroup(GROUP_ID).orElseThrow();
            loaded.incrementMemberCount();

            // When: second mutation collides, first must not land
            assertThatThrownBy(() -> repository.commit(RegistryTransaction.begin("join")
                    .update(loaded)
                    .create(membership(MEMBER_ID))))
                .isInstanceOf(AlreadyExistsException.class);

            // Then
            assertThat(repository.findGroup(GROUP_ID).orElseThrow().getMemberCount()).isEqualTo(1);
            assertThat(loaded.getVersion()).isEqualTo(1L);
        }

        @Test
        void commit_StaleUpdate_FailsWithVersionConflict() {
            // Given
            repository.commit(RegistryTransaction.begin("seed").create(group()));
            Group first = repository.findGroup(GROUP_ID).orElseThrow();
            Group second = repository.findGroup(GROUP_ID).orElseThrow();
            first.incrementMemberCount();
            repository.commit(RegistryTransaction.begin("winner").update(first));

            // When / Then
            second.incrementMemberCount();
            assertThatThrownBy(() -> repository.commit(RegistryTransaction.begin("loser").update(second)))
                .isInstanceOf(VersionConflictException.class);
            assertThat(repository.findGroup(GROUP_ID).orElseThrow().getMemberCount()).isEqualTo(2);
        }

        @Test
        void commit_DeleteMissingRecord_FailsWithVersionConflict() {
            assertThatThrownBy(() -> repository.commit(RegistryTransaction.begin("delete").delete(membership(MEMBER_ID))))
                .isInstanceOf(VersionConflictException.class);
        }

        @Test
        void commit_Delete_RemovesRecord() {
            repository.commit(RegistryTransaction.begin("seed").create(group()).create(membership(MEMBER_ID)));
            GroupMembership stored = repository.findMembership(GROUP_ID, MEMBER_ID).orElseThrow();

            repository.commit(RegistryTransaction.begin("leave").delete(stored));

            assertThat(repository.findMembership(GROUP_ID, MEMBER_ID)).isEmpty();
        }

        @Test
        void commit_RecordsStorageTimer() {
            repository.commit(RegistryTransaction.begin("seed").create(group()));

            assertThat(meterRegistry.find("registry.storage.duration")
                .tag("operation", "TransactWriteItems").tag("store", "memory").timer()).isNotNull();
        }
    }

    @Nested
    class Queries {

        @Test
        void findMembersByGroupId_ReturnsOnlyMemberships() {
            // Given
            repository.commit(RegistryTransaction.begin("seed")
                .create(group())
                .create(membership(MEMBER_ID))
                .create(membership(ADMIN_ID)));

            // When
            List<GroupMembership> members = repository.findMembersByGroupId(GROUP_ID);

            // Then
            assertThat(members).extracting(GroupMembership::getMemberId).containsExactly(ADMIN_ID, MEMBER_ID);
        }

        @Test
        void findGroupsByMemberId_UsesMemberIndex() {
            repository.commit(RegistryTransaction.begin("seed")
                .create(membership(MEMBER_ID))
                .create(new GroupMembership(OTHER_GROUP_ID, MEMBER_ID, GroupRole.ADMIN, memberKey(), OWNER_ID, NOW))
                .create(membership(ADMIN_ID)));

            List<GroupMembership> memberships = repository.findGroupsByMemberId(MEMBER_ID);

            assertThat(memberships).extracting(GroupMembership::getGroupId)
                .containsExactlyInAnyOrder(GROUP_ID, OTHER_GROUP_ID);
        }

        @Test
        void findPublicGroups_ReturnsOnlyIndexedGroups() {
            // Given
            Group hidden = group();
            Group listed = new Group(OTHER_GROUP_ID, OWNER_ID, "Chess", "", NOW);
            listed.setPublic(true);
            listed.setSearchable(true);
            listed.refreshDiscoverability();

            // When
            repository.commit(RegistryTransaction.begin("seed").create(hidden).create(listed));

            // Then
            assertThat(repository.findPublicGroups()).extracting(Group::getGroupId).containsExactly(OTHER_GROUP_ID);
        }

        @Test
        void loadedItems_AreIndependentCopies() {
            repository.commit(RegistryTransaction.begin("seed").create(group()));

            Group loaded = repository.findGroup(GROUP_ID).orElseThrow();
            loaded.setName("Changed locally");

            assertThat(repository.findGroup(GROUP_ID).orElseThrow().getName()).isEqualTo("Book Club");
        }
    }

    @Test
    void findGroup_CorruptRecord_ThrowsRepositoryException() {
        // Given: a group record stored under another group's key
        Map<String, AttributeValue> foreign = new HashMap<>(mapper.toAttributeMap(
            new Group(OTHER_GROUP_ID, OWNER_ID, "Impostor", "", NOW), 1L));
        foreign.put("pk", AttributeValue.builder().s("GROUP#" + GROUP_ID).build());
        repository.putRaw(foreign);

        // When / Then
        assertThatThrownBy(() -> repository.findGroup(GROUP_ID)).isInstanceOf(RepositoryException.class);
    }
}

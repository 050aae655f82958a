package com.keyregistry.groups.repository.impl;

import com.keyregistry.groups.exception.RepositoryException;
import com.keyregistry.groups.model.BaseItem;
import com.keyregistry.groups.model.CodeLookup;
import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.GroupRole;
import com.keyregistry.groups.model.InviteLink;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static com.keyregistry.groups.util.TestConstants.*;
import static org.assertj.core.api.Assertions.*;

class RegistryItemMapperTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final RegistryItemMapper mapper = new RegistryItemMapper();

    @Test
    void toAttributeMap_StampsVersionAndDiscriminator() {
        // Given
        Group group = new Group(GROUP_ID, OWNER_ID, "Book Club", "", NOW);
        group.setGroupEncryptionKey(groupKey());

        // When
        Map<String, AttributeValue> map = mapper.toAttributeMap(group, 4L);

        // Then
        assertThat(map.get("version").n()).isEqualTo("4");
        assertThat(map.get("itemType").s()).isEqualTo("GROUP");
        assertThat(map.get("pk").s()).isEqualTo("GROUP#" + GROUP_ID);
        assertThat(map.get("groupEncryptionKey").b().asByteArray()).isEqualTo(groupKey());
    }

    @Test
    void fromAttributeMap_DispatchesOnItemType() {
        // Given
        GroupMembership membership = new GroupMembership(GROUP_ID, MEMBER_ID, GroupRole.MODERATOR,
            memberKey(), OWNER_ID, NOW);
        InviteLink link = new InviteLink(GROUP_ID, INVITE_CODE, OWNER_ID, NOW.plusSeconds(60), 3, NOW);
        CodeLookup lookup = new CodeLookup("book-club", GROUP_ID, NOW);

        // When
        BaseItem readMembership = mapper.fromAttributeMap(mapper.toAttributeMap(membership, 1L));
        BaseItem readLink = mapper.fromAttributeMap(mapper.toAttributeMap(link, 1L));
        BaseItem readLookup = mapper.fromAttributeMap(mapper.toAttributeMap(lookup, 1L));

        // Then
        assertThat(readMembership).isInstanceOf(GroupMembership.class);
        assertThat(((GroupMembership) readMembership).getRole()).isEqualTo(GroupRole.MODERATOR);
        assertThat(((GroupMembership) readMembership).getJoinedAt()).isEqualTo(NOW);
        assertThat(readLink).isInstanceOf(InviteLink.class);
        assertThat(((InviteLink) readLink).getExpiresAt()).isEqualTo(NOW.plusSeconds(60));
        assertThat(readLookup).isInstanceOf(CodeLookup.class);
        assertThat(readLookup.getVersion()).isEqualTo(1L);
    }

    @Test
    void fromAttributeMap_GroupBooleanFlagsSurvive() {
        Group group = new Group(GROUP_ID, OWNER_ID, "Book Club", "", NOW);
        group.setPublic(true);
        group.setSearchable(true);
        group.setInviteOnly(true);

        Group read = mapper.fromAttributeMap(mapper.toAttributeMap(group, 1L), Group.class);

        assertThat(read.isPublic()).isTrue();
        assertThat(read.isSearchable()).isTrue();
        assertThat(read.isInviteOnly()).isTrue();
    }

    @Test
    void fromAttributeMap_WithoutItemType_Throws() {
        Map<String, AttributeValue> map = new HashMap<>(mapper.keyOf("GROUP#" + GROUP_ID, "METADATA"));

        assertThatThrownBy(() -> mapper.fromAttributeMap(map))
            .isInstanceOf(RepositoryException.class)
            .hasMessageContaining("itemType");
    }

    @Test
    void fromAttributeMap_WithUnknownItemType_Throws() {
        Map<String, AttributeValue> map = new HashMap<>(mapper.keyOf("GROUP#" + GROUP_ID, "METADATA"));
        map.put("itemType", AttributeValue.builder().s("CHANNEL").build());

        assertThatThrownBy(() -> mapper.fromAttributeMap(map)).isInstanceOf(RepositoryException.class);
    }

    @Test
    void fromAttributeMap_WithTamperedProof_Throws() {
        // Given
        Map<String, AttributeValue> map = new HashMap<>(mapper.toAttributeMap(
            new Group(GROUP_ID, OWNER_ID, "Book Club", "", NOW), 1L));
        map.put("addressProof", AttributeValue.builder().s("0".repeat(64)).build());

        // When / Then
        assertThatThrownBy(() -> mapper.fromAttributeMap(map))
            .isInstanceOf(RepositoryException.class)
            .hasMessageContaining("derived address");
    }

    @Test
    void fromAttributeMap_RecordStoredUnderForeignKey_Throws() {
        // A membership whose fields name another member than its sort key
        Map<String, AttributeValue> map = new HashMap<>(mapper.toAttributeMap(
            new GroupMembership(GROUP_ID, MEMBER_ID, GroupRole.MEMBER, memberKey(), OWNER_ID, NOW), 1L));
        map.put("memberId", AttributeValue.builder().s(ADMIN_ID).build());

        assertThatThrownBy(() -> mapper.fromAttributeMap(map)).isInstanceOf(RepositoryException.class);
    }

    @Test
    void fromAttributeMap_WithExpectedTypeMismatch_Throws() {
        Map<String, AttributeValue> map = mapper.toAttributeMap(new CodeLookup("book-club", GROUP_ID, NOW), 1L);

        assertThatThrownBy(() -> mapper.fromAttributeMap(map, Group.class))
            .isInstanceOf(RepositoryException.class);
    }
}

package com.keyregistry.groups.repository;

import com.keyregistry.groups.model.CodeLookup;
import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.InviteLink;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the GroupRegistryTable.
 * Reads go straight to derived addresses; every write goes through {@link #commit(RegistryTransaction)}.
 */
public interface GroupRepository {

    // Point reads at derived addresses
    Optional<Group> findGroup(String groupId);
    Optional<GroupMembership> findMembership(String groupId, String memberId);
    Optional<InviteLink> findInviteLink(String groupId, String inviteCode);
    Optional<CodeLookup> findCodeLookup(String publicCode);

    // Item collection queries
    List<GroupMembership> findMembersByGroupId(String groupId);
    List<InviteLink> findInviteLinksByGroupId(String groupId);

    /**
     * Find all memberships of an identity using the UserGroupIndex.
     */
    List<GroupMembership> findGroupsByMemberId(String memberId);

    /**
     * Groups that are both public and searchable, via the PublicGroupIndex.
     */
    List<Group> findPublicGroups();

    /**
     * Apply every staged mutation atomically, or none of them.
     *
     * @throws com.keyregistry.groups.exception.AlreadyExistsException a create hit an occupied address
     * @throws com.keyregistry.groups.exception.VersionConflictException an update or delete lost a race
     * @throws com.keyregistry.groups.exception.TransactionFailedException the store cancelled for another reason
     */
    void commit(RegistryTransaction transaction);
}

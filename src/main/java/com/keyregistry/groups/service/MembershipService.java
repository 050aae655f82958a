package com.keyregistry.groups.service;

import com.keyregistry.groups.dto.GroupMemberDTO;
import com.keyregistry.groups.model.GroupRole;

import java.time.Instant;
import java.util.List;

/**
 * Service interface for the membership lifecycle.
 * Every operation that adds or removes a member changes the group's member count in the
 * same transaction.
 */
public interface MembershipService {

    /**
     * Join a group as a MEMBER. Fails only on capacity or an existing membership.
     */
    GroupMemberDTO join(String groupId, byte[] encryptedGroupKey, String userId);

    /**
     * Join the group a public code resolves to. The code is matched case-insensitively.
     */
    GroupMemberDTO joinByCode(String code, byte[] encryptedGroupKey, String userId);

    /**
     * Join by redeeming an invite link. Membership, member count and the link's use count
     * are committed together.
     */
    GroupMemberDTO joinWithInviteLink(String groupId, String inviteCode, byte[] encryptedGroupKey, String userId);

    /**
     * Add another identity to the group directly.
     */
    GroupMemberDTO invite(String groupId, String inviteeId, byte[] encryptedGroupKey, String inviterId);

    void leave(String groupId, String userId);

    void kick(String groupId, String targetId, String kickerId);

    GroupMemberDTO updateRole(String groupId, String targetId, GroupRole newRole, String updaterId);

    /**
     * Advance the caller's read marker. A null timestamp means now.
     */
    GroupMemberDTO markRead(String groupId, Instant readAt, String userId);

    List<GroupMemberDTO> getMembers(String groupId, String requestingUserId);

    GroupMemberDTO getMembership(String groupId, String memberId, String requestingUserId);
}

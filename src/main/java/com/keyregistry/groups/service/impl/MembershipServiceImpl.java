package com.keyregistry.groups.service.impl;

import com.keyregistry.groups.dto.GroupMemberDTO;
import com.keyregistry.groups.exception.CapacityExceededException;
import com.keyregistry.groups.exception.ResourceNotFoundException;
import com.keyregistry.groups.exception.ValidationException;
import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupAction;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.GroupRole;
import com.keyregistry.groups.model.InviteLink;
import com.keyregistry.groups.repository.GroupRepository;
import com.keyregistry.groups.repository.RegistryTransaction;
import com.keyregistry.groups.service.AuthorizationRequest;
import com.keyregistry.groups.service.GroupAuditLogger;
import com.keyregistry.groups.service.GroupAuthorizationPolicy;
import com.keyregistry.groups.service.MembershipService;
import com.keyregistry.groups.util.GroupValidationRules;
import com.keyregistry.groups.util.RegistryKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Implementation of MembershipService.
 *
 * <p>The invite-only and require-approval flags are stored for clients; no join path reads them.
 *
 * <p>Capacity is checked against the member count read in this operation; the version
 * condition on the group record makes a concurrent admission fail this commit instead of
 * overfilling the group.
 */
@Service
public class MembershipServiceImpl implements MembershipService {

    private static final Logger logger = LoggerFactory.getLogger(MembershipServiceImpl.class);

    private final GroupRepository groupRepository;
    private final GroupAuthorizationPolicy authorizationPolicy;
    private final GroupAuditLogger auditLogger;
    private final Clock clock;

    @Autowired
    public MembershipServiceImpl(GroupRepository groupRepository, GroupAuthorizationPolicy authorizationPolicy,
                                 GroupAuditLogger auditLogger, Clock clock) {
        this.groupRepository = groupRepository;
        this.authorizationPolicy = authorizationPolicy;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    @Override
    public GroupMemberDTO join(String groupId, byte[] encryptedGroupKey, String userId) {
        GroupValidationRules.validateEncryptedMemberKey(encryptedGroupKey);
        // Reject malformed identifiers before any read
        RegistryKeyFactory.membershipAddress(groupId, userId);

        return admit(GroupRecords.requireGroup(groupRepository, groupId), encryptedGroupKey, userId, "join");
    }

    @Override
    public GroupMemberDTO joinByCode(String code, byte[] encryptedGroupKey, String userId) {
        GroupValidationRules.validateEncryptedMemberKey(encryptedGroupKey);

        Group group = GroupRecords.requireGroupByCode(groupRepository, code);
        RegistryKeyFactory.membershipAddress(group.getGroupId(), userId);
        return admit(group, encryptedGroupKey, userId, "joinByCode");
    }

    private GroupMemberDTO admit(Group group, byte[] encryptedGroupKey, String userId, String operation) {
        requireCapacity(group);

        Instant now = clock.instant();
        GroupMembership membership = new GroupMembership(
            group.getGroupId(), userId, GroupRole.MEMBER, encryptedGroupKey, userId, now);
        group.incrementMemberCount();
        group.touch(now);

        groupRepository.commit(RegistryTransaction.begin(operation)
            .create(membership)
            .update(group));

        logger.info("User {} joined group {} (member count: {})", userId, group.getGroupId(), group.getMemberCount());
        auditLogger.logJoin(userId, group, null);
        return new GroupMemberDTO(membership, true);
    }

    @Override
    public GroupMemberDTO joinWithInviteLink(String groupId, String inviteCode, byte[] encryptedGroupKey,
                                             String userId) {
        GroupValidationRules.validateInviteCode(inviteCode);
        GroupValidationRules.validateEncryptedMemberKey(encryptedGroupKey);
        // Reject malformed identifiers before any read
        RegistryKeyFactory.membershipAddress(groupId, userId);

        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        InviteLink link = groupRepository.findInviteLink(group.getGroupId(), inviteCode)
            .orElseThrow(() -> new ResourceNotFoundException("Invite link not found: " + inviteCode));

        Instant now = clock.instant();
        link.checkRedeemable(now);
        requireCapacity(group);

        GroupMembership membership = new GroupMembership(
            group.getGroupId(), userId, GroupRole.MEMBER, encryptedGroupKey, link.getCreatedBy(), now);
        membership.setInviteCode(link.getInviteCode());
        group.incrementMemberCount();
        group.touch(now);
        link.recordUse();
        link.touch(now);

        groupRepository.commit(RegistryTransaction.begin("joinWithInviteLink")
            .create(membership)
            .update(group)
            .update(link));

        logger.info("User {} joined group {} with invite link {} (uses: {}/{})",
            userId, group.getGroupId(), inviteCode, link.getUseCount(), link.getMaxUses());
        auditLogger.logJoin(userId, group, inviteCode);
        return new GroupMemberDTO(membership, true);
    }

    @Override
    public GroupMemberDTO invite(String groupId, String inviteeId, byte[] encryptedGroupKey, String inviterId) {
        GroupValidationRules.validateEncryptedMemberKey(encryptedGroupKey);
        // Reject malformed identifiers before any read
        RegistryKeyFactory.membershipAddress(groupId, inviteeId);

        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        GroupMembership inviter = GroupRecords.requireCaller(groupRepository, group.getGroupId(), inviterId);
        authorizationPolicy.authorize(AuthorizationRequest.of(GroupAction.INVITE_MEMBER, group, inviter));
        requireCapacity(group);

        Instant now = clock.instant();
        GroupMembership membership = new GroupMembership(
            group.getGroupId(), inviteeId, GroupRole.MEMBER, encryptedGroupKey, inviterId, now);
        group.incrementMemberCount();
        group.touch(now);

        groupRepository.commit(RegistryTransaction.begin("invite")
            .create(membership)
            .update(group));

        logger.info("User {} invited to group {} by {} (member count: {})",
            inviteeId, group.getGroupId(), inviterId, group.getMemberCount());
        auditLogger.logInvite(inviterId, group, inviteeId);
        return new GroupMemberDTO(membership, false);
    }

    @Override
    public void leave(String groupId, String userId) {
        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        GroupMembership membership = GroupRecords.requireCaller(groupRepository, group.getGroupId(), userId);
        authorizationPolicy.authorize(AuthorizationRequest.of(GroupAction.LEAVE, group, membership));

        group.decrementMemberCount();
        group.touch(clock.instant());

        groupRepository.commit(RegistryTransaction.begin("leave")
            .delete(membership)
            .update(group));

        logger.info("User {} left group {} (member count: {})", userId, group.getGroupId(), group.getMemberCount());
        auditLogger.logLeave(userId, group);
    }

    @Override
    public void kick(String groupId, String targetId, String kickerId) {
        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        GroupMembership kicker = GroupRecords.requireCaller(groupRepository, group.getGroupId(), kickerId);
        GroupMembership target = GroupRecords.requireMember(groupRepository, group.getGroupId(), targetId);
        authorizationPolicy.authorize(AuthorizationRequest.of(GroupAction.KICK_MEMBER, group, kicker)
            .withTarget(target));

        group.decrementMemberCount();
        group.touch(clock.instant());

        groupRepository.commit(RegistryTransaction.begin("kick")
            .delete(target)
            .update(group));

        logger.info("User {} kicked {} from group {} (member count: {})",
            kickerId, targetId, group.getGroupId(), group.getMemberCount());
        auditLogger.logKick(kickerId, group, targetId);
    }

    @Override
    public GroupMemberDTO updateRole(String groupId, String targetId, GroupRole newRole, String updaterId) {
        if (newRole == null) {
            throw new ValidationException("role", "Role is required");
        }

        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        GroupMembership updater = GroupRecords.requireCaller(groupRepository, group.getGroupId(), updaterId);
        GroupMembership target = GroupRecords.requireMember(groupRepository, group.getGroupId(), targetId);
        authorizationPolicy.authorize(AuthorizationRequest.of(GroupAction.UPDATE_ROLE, group, updater)
            .withTarget(target)
            .withNewRole(newRole));

        GroupRole previousRole = target.getRole();
        target.applyRole(newRole);
        target.touch(clock.instant());

        groupRepository.commit(RegistryTransaction.begin("updateRole").update(target));

        logger.info("User {} changed role of {} in group {} from {} to {}",
            updaterId, targetId, group.getGroupId(), previousRole, newRole);
        auditLogger.logRoleChange(updaterId, group, targetId, previousRole, newRole);
        return new GroupMemberDTO(target, targetId.equals(updaterId));
    }

    @Override
    public GroupMemberDTO markRead(String groupId, Instant readAt, String userId) {
        GroupMembership membership = GroupRecords.requireCaller(groupRepository, groupId, userId);

        Instant now = clock.instant();
        Instant marker = readAt == null || readAt.isAfter(now) ? now : readAt;
        if (membership.getJoinedAt() != null && marker.isBefore(membership.getJoinedAt())) {
            throw new ValidationException("readAt", "Read marker cannot be earlier than the join time");
        }

        // Never moves backwards; an older marker is a no-op
        if (membership.getLastReadAt() != null && !marker.isAfter(membership.getLastReadAt())) {
            return new GroupMemberDTO(membership, true);
        }

        membership.setLastReadAt(marker);
        membership.touch(now);
        groupRepository.commit(RegistryTransaction.begin("markRead").update(membership));

        logger.debug("User {} read group {} up to {}", userId, membership.getGroupId(), marker);
        return new GroupMemberDTO(membership, true);
    }

    @Override
    public List<GroupMemberDTO> getMembers(String groupId, String requestingUserId) {
        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        GroupMembership caller = groupRepository.findMembership(group.getGroupId(), requestingUserId).orElse(null);
        GroupRecords.requireVisible(group, caller);

        return groupRepository.findMembersByGroupId(group.getGroupId()).stream()
            .map(member -> new GroupMemberDTO(member, member.getMemberId().equals(requestingUserId)))
            .collect(Collectors.toList());
    }

    @Override
    public GroupMemberDTO getMembership(String groupId, String memberId, String requestingUserId) {
        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        GroupMembership caller = groupRepository.findMembership(group.getGroupId(), requestingUserId).orElse(null);
        GroupRecords.requireVisible(group, caller);

        GroupMembership membership = GroupRecords.requireMember(groupRepository, group.getGroupId(), memberId);
        return new GroupMemberDTO(membership, memberId.equals(requestingUserId));
    }

    private static void requireCapacity(Group group) {
        if (!group.hasCapacity()) {
            throw new CapacityExceededException(group.getGroupId(), group.getMaxMembers());
        }
    }
}

package com.keyregistry.groups.service.impl;

import com.keyregistry.groups.dto.CreateGroupRequest;
import com.keyregistry.groups.dto.GroupDTO;
import com.keyregistry.groups.dto.UpdateGroupRequest;
import com.keyregistry.groups.exception.InvalidStateException;
import com.keyregistry.groups.exception.PermissionDeniedException;
import com.keyregistry.groups.exception.ValidationException;
import com.keyregistry.groups.model.CodeLookup;
import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupAction;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.GroupRole;
import com.keyregistry.groups.repository.GroupRepository;
import com.keyregistry.groups.repository.RegistryTransaction;
import com.keyregistry.groups.service.AuthorizationRequest;
import com.keyregistry.groups.service.GroupAuditLogger;
import com.keyregistry.groups.service.GroupAuthorizationPolicy;
import com.keyregistry.groups.service.GroupService;
import com.keyregistry.groups.util.GroupValidationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Implementation of GroupService.
 * Each write builds one RegistryTransaction and hands it to the repository.
 */
@Service
public class GroupServiceImpl implements GroupService {

    private static final Logger logger = LoggerFactory.getLogger(GroupServiceImpl.class);
    private static final int OWNER_KEY_BYTES = GroupValidationRules.MEMBER_KEY_BYTES;

    private final GroupRepository groupRepository;
    private final GroupAuthorizationPolicy authorizationPolicy;
    private final GroupAuditLogger auditLogger;
    private final Clock clock;

    @Autowired
    public GroupServiceImpl(GroupRepository groupRepository, GroupAuthorizationPolicy authorizationPolicy,
                            GroupAuditLogger auditLogger, Clock clock) {
        this.groupRepository = groupRepository;
        this.authorizationPolicy = authorizationPolicy;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    @Override
    public GroupDTO createGroup(CreateGroupRequest request, String creatorId) {
        // Input validation
        GroupValidationRules.validateGroupName(request.getName());
        GroupValidationRules.validateDescription(request.getDescription());
        GroupValidationRules.validateAvatarRef(request.getAvatarRef());
        int maxMembers = request.getMaxMembers() != null ? request.getMaxMembers() : 0;
        GroupValidationRules.validateMaxMembers(maxMembers);
        GroupValidationRules.validateGroupEncryptionKey(request.getGroupEncryptionKey());

        Instant now = clock.instant();
        Group group = new Group(request.getGroupId(), creatorId, request.getName(), request.getDescription(), now);
        if (request.getAvatarRef() != null) {
            group.setAvatarRef(request.getAvatarRef());
        }
        group.setPublic(Boolean.TRUE.equals(request.isPublic()));
        group.setSearchable(Boolean.TRUE.equals(request.isSearchable()));
        group.setInviteOnly(Boolean.TRUE.equals(request.getInviteOnly()));
        group.setRequireApproval(Boolean.TRUE.equals(request.getRequireApproval()));
        group.setAllowMemberInvites(Boolean.TRUE.equals(request.getAllowMemberInvites()));
        group.setEnableReplies(!Boolean.FALSE.equals(request.getEnableReplies()));
        group.setEnableReactions(!Boolean.FALSE.equals(request.getEnableReactions()));
        group.setEnableReadReceipts(!Boolean.FALSE.equals(request.getEnableReadReceipts()));
        group.setEnableTypingIndicators(!Boolean.FALSE.equals(request.getEnableTypingIndicators()));
        group.setMaxMembers(maxMembers);
        group.setGroupEncryptionKey(request.getGroupEncryptionKey());
        group.refreshDiscoverability();

        // The owner already holds the group key, so their wrapped copy is zeroed
        GroupMembership ownerMembership = new GroupMembership(
            group.getGroupId(), creatorId, GroupRole.OWNER, new byte[OWNER_KEY_BYTES], creatorId, now);

        groupRepository.commit(RegistryTransaction.begin("createGroup")
            .create(group)
            .create(ownerMembership));

        logger.info("Created group {} with owner {}", group.getGroupId(), creatorId);
        auditLogger.logGroupCreated(creatorId, group);
        return new GroupDTO(group, ownerMembership);
    }

    @Override
    public GroupDTO setGroupCode(String groupId, String code, String requestingUserId) {
        GroupValidationRules.validatePublicCode(code);

        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        if (!group.isOwnedBy(requestingUserId)) {
            throw new PermissionDeniedException(PermissionDeniedException.Reason.NOT_GROUP_OWNER,
                "Only the group owner can set its public code");
        }

        Instant now = clock.instant();
        CodeLookup lookup = new CodeLookup(code, group.getGroupId(), now);
        String previousCode = group.getPublicCode();
        group.setPublicCode(lookup.getPublicCode());
        group.touch(now);

        // A previous code's lookup is left in place and keeps resolving to this group
        groupRepository.commit(RegistryTransaction.begin("setGroupCode")
            .create(lookup)
            .update(group));

        if (previousCode != null) {
            logger.info("Group {} public code changed from '{}' to '{}'", group.getGroupId(), previousCode, code);
        } else {
            logger.info("Group {} public code set to '{}'", group.getGroupId(), code);
        }
        auditLogger.logCodeSet(requestingUserId, group, lookup.getPublicCode());

        GroupMembership ownerMembership = groupRepository.findMembership(group.getGroupId(), requestingUserId)
            .orElse(null);
        return new GroupDTO(group, ownerMembership);
    }

    @Override
    public GroupDTO updateGroupSettings(String groupId, UpdateGroupRequest request, String requestingUserId) {
        if (!request.hasUpdates()) {
            throw new ValidationException("request", "No valid fields provided for update");
        }
        if (request.getName() != null) {
            GroupValidationRules.validateGroupName(request.getName());
        }
        GroupValidationRules.validateDescription(request.getDescription());
        GroupValidationRules.validateAvatarRef(request.getAvatarRef());
        if (request.getMaxMembers() != null) {
            GroupValidationRules.validateMaxMembers(request.getMaxMembers());
        }

        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        GroupMembership membership = GroupRecords.requireCaller(groupRepository, group.getGroupId(), requestingUserId);
        authorizationPolicy.authorize(AuthorizationRequest.of(GroupAction.UPDATE_SETTINGS, group, membership));

        if (request.getMaxMembers() != null && request.getMaxMembers() != 0
                && request.getMaxMembers() < group.getMemberCount()) {
            throw new InvalidStateException(InvalidStateException.Reason.MAX_MEMBERS_BELOW_COUNT,
                "Max members " + request.getMaxMembers() + " is below the current member count "
                    + group.getMemberCount());
        }

        // Update only provided fields
        if (request.getName() != null) {
            group.setName(request.getName());
        }
        if (request.getDescription() != null) {
            group.setDescription(request.getDescription());
        }
        if (request.getAvatarRef() != null) {
            group.setAvatarRef(request.getAvatarRef());
        }
        if (request.isPublic() != null) {
            group.setPublic(request.isPublic());
        }
        if (request.isSearchable() != null) {
            group.setSearchable(request.isSearchable());
        }
        if (request.getInviteOnly() != null) {
            group.setInviteOnly(request.getInviteOnly());
        }
        if (request.getRequireApproval() != null) {
            group.setRequireApproval(request.getRequireApproval());
        }
        if (request.getAllowMemberInvites() != null) {
            group.setAllowMemberInvites(request.getAllowMemberInvites());
        }
        if (request.getEnableReplies() != null) {
            group.setEnableReplies(request.getEnableReplies());
        }
        if (request.getEnableReactions() != null) {
            group.setEnableReactions(request.getEnableReactions());
        }
        if (request.getEnableReadReceipts() != null) {
            group.setEnableReadReceipts(request.getEnableReadReceipts());
        }
        if (request.getEnableTypingIndicators() != null) {
            group.setEnableTypingIndicators(request.getEnableTypingIndicators());
        }
        if (request.getMaxMembers() != null) {
            group.setMaxMembers(request.getMaxMembers());
        }
        group.refreshDiscoverability();
        group.touch(clock.instant());

        groupRepository.commit(RegistryTransaction.begin("updateGroupSettings").update(group));

        logger.info("Updated group {} settings by user {}", group.getGroupId(), requestingUserId);
        auditLogger.logSettingsUpdated(requestingUserId, group);
        return new GroupDTO(group, membership);
    }

    @Override
    public GroupDTO getGroup(String groupId, String requestingUserId) {
        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        GroupMembership membership = groupRepository.findMembership(group.getGroupId(), requestingUserId)
            .orElse(null);
        GroupRecords.requireVisible(group, membership);
        return new GroupDTO(group, membership);
    }

    @Override
    public List<GroupDTO> getUserGroups(String userId) {
        List<GroupMembership> memberships = groupRepository.findGroupsByMemberId(userId);
        List<GroupDTO> groups = new ArrayList<>();
        for (GroupMembership membership : memberships) {
            Optional<Group> group = groupRepository.findGroup(membership.getGroupId());
            if (group.isPresent()) {
                groups.add(new GroupDTO(group.get(), membership));
            } else {
                logger.warn("Membership of {} points at missing group {}", userId, membership.getGroupId());
            }
        }
        return groups;
    }

    @Override
    public List<GroupDTO> searchPublicGroups(String query) {
        String needle = query != null ? query.trim().toLowerCase(Locale.ROOT) : "";
        return groupRepository.findPublicGroups().stream()
            .filter(group -> group.isPublic() && group.isSearchable())
            .filter(group -> needle.isEmpty() || group.getName().toLowerCase(Locale.ROOT).contains(needle))
            .sorted(Comparator.comparing(Group::getName, String.CASE_INSENSITIVE_ORDER))
            .map(group -> new GroupDTO(group, null))
            .collect(Collectors.toList());
    }
}

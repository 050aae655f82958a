package com.keyregistry.groups.service.impl;

import com.keyregistry.groups.dto.CreateInviteLinkRequest;
import com.keyregistry.groups.dto.InviteLinkDTO;
import com.keyregistry.groups.exception.ResourceNotFoundException;
import com.keyregistry.groups.exception.ValidationException;
import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupAction;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.InviteLink;
import com.keyregistry.groups.repository.GroupRepository;
import com.keyregistry.groups.repository.RegistryTransaction;
import com.keyregistry.groups.service.AuthorizationRequest;
import com.keyregistry.groups.service.GroupAuditLogger;
import com.keyregistry.groups.service.GroupAuthorizationPolicy;
import com.keyregistry.groups.service.InviteLinkService;
import com.keyregistry.groups.util.GroupValidationRules;
import com.keyregistry.groups.util.InviteCodeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class InviteLinkServiceImpl implements InviteLinkService {

    private static final Logger logger = LoggerFactory.getLogger(InviteLinkServiceImpl.class);

    private final GroupRepository groupRepository;
    private final GroupAuthorizationPolicy authorizationPolicy;
    private final GroupAuditLogger auditLogger;
    private final Clock clock;

    @Autowired
    public InviteLinkServiceImpl(GroupRepository groupRepository, GroupAuthorizationPolicy authorizationPolicy,
                                 GroupAuditLogger auditLogger, Clock clock) {
        this.groupRepository = groupRepository;
        this.authorizationPolicy = authorizationPolicy;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    @Override
    public InviteLinkDTO createInviteLink(String groupId, CreateInviteLinkRequest request, String creatorId) {
        String requestedCode = request.getCode();
        if (requestedCode != null) {
            GroupValidationRules.validateInviteCode(requestedCode);
        }
        int maxUses = request.getMaxUses() != null ? request.getMaxUses() : 0;
        GroupValidationRules.validateMaxUses(maxUses);
        long expiresAtSeconds = request.getExpiresAt() != null ? request.getExpiresAt() : 0L;
        if (expiresAtSeconds < 0) {
            throw new ValidationException("expiresAt", "Expiry cannot be negative");
        }

        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        GroupMembership creator = GroupRecords.requireCaller(groupRepository, group.getGroupId(), creatorId);
        authorizationPolicy.authorize(AuthorizationRequest.of(GroupAction.CREATE_INVITE_LINK, group, creator));

        String code = requestedCode != null
            ? requestedCode
            : InviteCodeGenerator.generateUnique(
                candidate -> groupRepository.findInviteLink(group.getGroupId(), candidate).isPresent());

        Instant now = clock.instant();
        Instant expiresAt = expiresAtSeconds == 0L ? null : Instant.ofEpochSecond(expiresAtSeconds);
        InviteLink link = new InviteLink(group.getGroupId(), code, creatorId, expiresAt, maxUses, now);

        groupRepository.commit(RegistryTransaction.begin("createInviteLink").create(link));

        logger.info("User {} created invite link {} for group {} (maxUses: {}, expiresAt: {})",
            creatorId, code, group.getGroupId(), maxUses, expiresAt);
        auditLogger.logInviteLinkCreated(creatorId, group, code);
        return new InviteLinkDTO(link);
    }

    @Override
    public InviteLinkDTO revokeInviteLink(String groupId, String inviteCode, String requestingUserId) {
        GroupValidationRules.validateInviteCode(inviteCode);

        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        GroupMembership caller = GroupRecords.requireCaller(groupRepository, group.getGroupId(), requestingUserId);
        InviteLink link = requireLink(group.getGroupId(), inviteCode);
        authorizationPolicy.authorize(AuthorizationRequest.of(GroupAction.REVOKE_INVITE_LINK, group, caller)
            .withInviteLink(link));

        if (!link.isActive()) {
            logger.debug("Invite link {} in group {} already revoked", inviteCode, group.getGroupId());
            return new InviteLinkDTO(link);
        }

        Instant now = clock.instant();
        link.revoke(requestingUserId, now);
        link.touch(now);
        groupRepository.commit(RegistryTransaction.begin("revokeInviteLink").update(link));

        logger.info("User {} revoked invite link {} for group {}", requestingUserId, inviteCode, group.getGroupId());
        auditLogger.logInviteLinkRevoked(requestingUserId, group, inviteCode);
        return new InviteLinkDTO(link);
    }

    @Override
    public List<InviteLinkDTO> listInviteLinks(String groupId, String requestingUserId) {
        Group group = GroupRecords.requireGroup(groupRepository, groupId);
        GroupMembership caller = GroupRecords.requireCaller(groupRepository, group.getGroupId(), requestingUserId);
        authorizationPolicy.authorize(AuthorizationRequest.of(GroupAction.LIST_INVITE_LINKS, group, caller));

        return groupRepository.findInviteLinksByGroupId(group.getGroupId()).stream()
            .sorted(Comparator.comparing(InviteLink::getCreatedAt))
            .map(InviteLinkDTO::new)
            .collect(Collectors.toList());
    }

    @Override
    public InviteLinkDTO getInviteLink(String groupId, String inviteCode) {
        GroupValidationRules.validateInviteCode(inviteCode);
        return new InviteLinkDTO(requireLink(groupId, inviteCode));
    }

    private InviteLink requireLink(String groupId, String inviteCode) {
        return groupRepository.findInviteLink(groupId, inviteCode)
            .orElseThrow(() -> new ResourceNotFoundException("Invite link not found: " + inviteCode));
    }
}

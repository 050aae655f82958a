package com.keyregistry.groups.service.impl;

import com.keyregistry.groups.exception.InvalidStateException;
import com.keyregistry.groups.exception.PermissionDeniedException;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.GroupRole;
import com.keyregistry.groups.model.Permission;
import com.keyregistry.groups.service.AuthorizationDecision;
import com.keyregistry.groups.service.AuthorizationRequest;
import com.keyregistry.groups.service.GroupAuthorizationPolicy;
import org.springframework.stereotype.Component;

import static com.keyregistry.groups.service.AuthorizationDecision.allow;
import static com.keyregistry.groups.service.AuthorizationDecision.deny;
import static com.keyregistry.groups.service.AuthorizationDecision.violation;

/**
 * Role and rank rules for group actions.
 *
 * <p>Authority is checked before target rules, so a caller without authority learns nothing
 * about the target.
 */
@Component
public class GroupAuthorizationPolicyImpl implements GroupAuthorizationPolicy {

    @Override
    public AuthorizationDecision evaluate(AuthorizationRequest request) {
        GroupMembership actor = request.getActor();
        if (actor == null) {
            return deny(PermissionDeniedException.Reason.NOT_A_MEMBER, "Caller is not a member of this group");
        }

        switch (request.getAction()) {
            case INVITE_MEMBER:
            case CREATE_INVITE_LINK:
            case LIST_INVITE_LINKS:
                return evaluateInvite(request, actor);
            case KICK_MEMBER:
                return evaluateKick(request, actor);
            case UPDATE_ROLE:
                return evaluateRoleChange(request, actor);
            case REVOKE_INVITE_LINK:
                return evaluateRevoke(request, actor);
            case UPDATE_SETTINGS:
                return actor.isOwner() || actor.getRole() == GroupRole.ADMIN
                    ? allow()
                    : deny(PermissionDeniedException.Reason.INSUFFICIENT_ROLE, "Managing settings requires an admin");
            case LEAVE:
                return actor.isOwner()
                    ? violation(InvalidStateException.Reason.OWNER_CANNOT_LEAVE, "The owner cannot leave the group")
                    : allow();
            default:
                throw new IllegalArgumentException("Unhandled action: " + request.getAction());
        }
    }

    private AuthorizationDecision evaluateInvite(AuthorizationRequest request, GroupMembership actor) {
        if (actor.getRole().isStaff()) {
            return allow();
        }
        if (!request.getGroup().isAllowMemberInvites()) {
            return deny(PermissionDeniedException.Reason.MEMBER_INVITES_DISABLED,
                "Members may not invite in this group");
        }
        if (!actor.hasPermission(Permission.INVITE_MEMBERS)) {
            return deny(PermissionDeniedException.Reason.INSUFFICIENT_ROLE, "Member lacks the invite permission");
        }
        return allow();
    }

    private AuthorizationDecision evaluateKick(AuthorizationRequest request, GroupMembership actor) {
        GroupMembership target = requireTarget(request);
        if (!actor.getRole().isStaff() || !actor.hasPermission(Permission.KICK_MEMBERS)) {
            return deny(PermissionDeniedException.Reason.INSUFFICIENT_ROLE, "Kicking requires a moderator");
        }
        if (target.isOwner()) {
            return violation(InvalidStateException.Reason.CANNOT_KICK_OWNER, "The owner cannot be kicked");
        }
        if (target.getMemberId().equals(actor.getMemberId())) {
            return violation(InvalidStateException.Reason.CANNOT_KICK_SELF, "Use leave to remove yourself");
        }
        if (!actor.isOwner() && !actor.getRole().outranks(target.getRole())) {
            return deny(PermissionDeniedException.Reason.INSUFFICIENT_RANK,
                actor.getRole() + " cannot kick " + target.getRole());
        }
        return allow();
    }

    private AuthorizationDecision evaluateRoleChange(AuthorizationRequest request, GroupMembership actor) {
        GroupMembership target = requireTarget(request);
        GroupRole newRole = request.getNewRole();
        if (newRole == null) {
            throw new IllegalArgumentException("UPDATE_ROLE requires a new role");
        }
        GroupRole actorRole = actor.getRole();
        if (actorRole != GroupRole.OWNER && actorRole != GroupRole.ADMIN) {
            return deny(PermissionDeniedException.Reason.INSUFFICIENT_ROLE, "Changing roles requires an admin");
        }
        if (target.isOwner()) {
            return violation(InvalidStateException.Reason.CANNOT_CHANGE_OWNER_ROLE, "The owner's role cannot change");
        }
        if (newRole == GroupRole.OWNER) {
            return violation(InvalidStateException.Reason.CANNOT_ASSIGN_OWNER, "Ownership cannot be assigned");
        }
        if (newRole == GroupRole.ADMIN && actorRole != GroupRole.OWNER) {
            return deny(PermissionDeniedException.Reason.NOT_GROUP_OWNER, "Only the owner can appoint admins");
        }
        return allow();
    }

    private AuthorizationDecision evaluateRevoke(AuthorizationRequest request, GroupMembership actor) {
        if (request.getInviteLink() == null) {
            throw new IllegalArgumentException("REVOKE_INVITE_LINK requires an invite link");
        }
        if (actor.getRole().isStaff() || actor.getMemberId().equals(request.getInviteLink().getCreatedBy())) {
            return allow();
        }
        return deny(PermissionDeniedException.Reason.INSUFFICIENT_ROLE,
            "Only the link creator or a moderator can revoke it");
    }

    private static GroupMembership requireTarget(AuthorizationRequest request) {
        if (request.getTarget() == null) {
            throw new IllegalArgumentException(request.getAction() + " requires a target membership");
        }
        return request.getTarget();
    }
}

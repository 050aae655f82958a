package com.keyregistry.groups.service;

import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupAction;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.GroupRole;
import com.keyregistry.groups.model.InviteLink;

/**
 * Everything the authorization policy needs to decide one action: the group, the acting
 * member's record and, depending on the action, a target membership, a requested role or
 * an invite link.
 */
public final class AuthorizationRequest {

    private final GroupAction action;
    private final Group group;
    private final GroupMembership actor;
    private final GroupMembership target;
    private final GroupRole newRole;
    private final InviteLink inviteLink;

    private AuthorizationRequest(GroupAction action, Group group, GroupMembership actor,
                                 GroupMembership target, GroupRole newRole, InviteLink inviteLink) {
        this.action = action;
        this.group = group;
        this.actor = actor;
        this.target = target;
        this.newRole = newRole;
        this.inviteLink = inviteLink;
    }

    /**
     * @param actor the caller's membership, or null when the caller is not a member
     */
    public static AuthorizationRequest of(GroupAction action, Group group, GroupMembership actor) {
        return new AuthorizationRequest(action, group, actor, null, null, null);
    }

    public AuthorizationRequest withTarget(GroupMembership target) {
        return new AuthorizationRequest(action, group, actor, target, newRole, inviteLink);
    }

    public AuthorizationRequest withNewRole(GroupRole role) {
        return new AuthorizationRequest(action, group, actor, target, role, inviteLink);
    }

    public AuthorizationRequest withInviteLink(InviteLink link) {
        return new AuthorizationRequest(action, group, actor, target, newRole, link);
    }

    public GroupAction getAction() {
        return action;
    }

    public Group getGroup() {
        return group;
    }

    public GroupMembership getActor() {
        return actor;
    }

    public GroupMembership getTarget() {
        return target;
    }

    public GroupRole getNewRole() {
        return newRole;
    }

    public InviteLink getInviteLink() {
        return inviteLink;
    }
}

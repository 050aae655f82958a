package com.keyregistry.groups.service;

import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Audit trail of committed group changes, written to its own logger so it can be routed
 * separately from application logs. Called only after a transaction commits.
 */
@Component
public class GroupAuditLogger {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("group-registry.audit");

    public void logGroupCreated(String actor, Group group) {
        AUDIT_LOG.info("GROUP_AUDIT actor={} action=create_group group={} target={} memberCount={}",
            actor, group.getGroupId(), actor, group.getMemberCount());
    }

    public void logCodeSet(String actor, Group group, String publicCode) {
        AUDIT_LOG.info("GROUP_AUDIT actor={} action=set_code group={} target={} memberCount={}",
            actor, group.getGroupId(), publicCode, group.getMemberCount());
    }

    public void logSettingsUpdated(String actor, Group group) {
        AUDIT_LOG.info("GROUP_AUDIT actor={} action=update_settings group={} target={} memberCount={}",
            actor, group.getGroupId(), group.getGroupId(), group.getMemberCount());
    }

    /** Log a join, either open or through an invite link (inviteCode null for open joins). */
    public void logJoin(String actor, Group group, String inviteCode) {
        if (inviteCode == null) {
            AUDIT_LOG.info("GROUP_AUDIT actor={} action=join group={} target={} memberCount={}",
                actor, group.getGroupId(), actor, group.getMemberCount());
        } else {
            AUDIT_LOG.info("GROUP_AUDIT actor={} action=join_with_link group={} target={} memberCount={} inviteCode={}",
                actor, group.getGroupId(), actor, group.getMemberCount(), inviteCode);
        }
    }

    public void logInvite(String actor, Group group, String invitee) {
        AUDIT_LOG.info("GROUP_AUDIT actor={} action=invite group={} target={} memberCount={}",
            actor, group.getGroupId(), invitee, group.getMemberCount());
    }

    public void logLeave(String actor, Group group) {
        AUDIT_LOG.info("GROUP_AUDIT actor={} action=leave group={} target={} memberCount={}",
            actor, group.getGroupId(), actor, group.getMemberCount());
    }

    public void logKick(String actor, Group group, String target) {
        AUDIT_LOG.info("GROUP_AUDIT actor={} action=kick group={} target={} memberCount={}",
            actor, group.getGroupId(), target, group.getMemberCount());
    }

    public void logRoleChange(String actor, Group group, String target, GroupRole fromRole, GroupRole toRole) {
        AUDIT_LOG.info("GROUP_AUDIT actor={} action=update_role group={} target={} memberCount={} fromRole={} toRole={}",
            actor, group.getGroupId(), target, group.getMemberCount(), fromRole, toRole);
    }

    public void logInviteLinkCreated(String actor, Group group, String inviteCode) {
        AUDIT_LOG.info("GROUP_AUDIT actor={} action=create_invite_link group={} target={} memberCount={}",
            actor, group.getGroupId(), inviteCode, group.getMemberCount());
    }

    public void logInviteLinkRevoked(String actor, Group group, String inviteCode) {
        AUDIT_LOG.info("GROUP_AUDIT actor={} action=revoke_invite_link group={} target={} memberCount={}",
            actor, group.getGroupId(), inviteCode, group.getMemberCount());
    }
}

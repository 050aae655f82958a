package com.keyregistry.groups.dto;

import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.GroupRole;

import java.time.Instant;

/**
 * Data Transfer Object for a member in a group roster.
 * The encrypted group key is only included when the member is looking at their own record.
 */
public class GroupMemberDTO {

    private String groupId;
    private String memberId;
    private GroupRole role;
    private int permissions;
    private Instant joinedAt;
    private Instant lastReadAt;
    private boolean isActive;
    private boolean isMuted;
    private boolean isBanned;
    private String invitedBy;
    private byte[] encryptedGroupKey;

    public GroupMemberDTO() {}

    public GroupMemberDTO(GroupMembership membership, boolean includeKey) {
        this.groupId = membership.getGroupId();
        this.memberId = membership.getMemberId();
        this.role = membership.getRole();
        this.permissions = membership.getPermissions();
        this.joinedAt = membership.getJoinedAt();
        this.lastReadAt = membership.getLastReadAt();
        this.isActive = membership.isActive();
        this.isMuted = membership.isMuted();
        this.isBanned = membership.isBanned();
        this.invitedBy = membership.getInvitedBy();
        if (includeKey) {
            this.encryptedGroupKey = membership.getEncryptedGroupKey();
        }
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getMemberId() {
        return memberId;
    }

    public void setMemberId(String memberId) {
        this.memberId = memberId;
    }

    public GroupRole getRole() {
        return role;
    }

    public void setRole(GroupRole role) {
        this.role = role;
    }

    public int getPermissions() {
        return permissions;
    }

    public void setPermissions(int permissions) {
        this.permissions = permissions;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public void setJoinedAt(Instant joinedAt) {
        this.joinedAt = joinedAt;
    }

    public Instant getLastReadAt() {
        return lastReadAt;
    }

    public void setLastReadAt(Instant lastReadAt) {
        this.lastReadAt = lastReadAt;
    }

    public boolean isActive() {
        return isActive;
    }

    public void setActive(boolean active) {
        isActive = active;
    }

    public boolean isMuted() {
        return isMuted;
    }

    public void setMuted(boolean muted) {
        isMuted = muted;
    }

    public boolean isBanned() {
        return isBanned;
    }

    public void setBanned(boolean banned) {
        isBanned = banned;
    }

    public String getInvitedBy() {
        return invitedBy;
    }

    public void setInvitedBy(String invitedBy) {
        this.invitedBy = invitedBy;
    }

    public byte[] getEncryptedGroupKey() {
        return encryptedGroupKey;
    }

    public void setEncryptedGroupKey(byte[] encryptedGroupKey) {
        this.encryptedGroupKey = encryptedGroupKey;
    }
}

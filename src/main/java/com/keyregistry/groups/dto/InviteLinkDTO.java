package com.keyregistry.groups.dto;

import com.keyregistry.groups.model.InviteLink;

import java.time.Instant;

/**
 * Data Transfer Object for an invite link. {@code expiresAt} is epoch seconds, 0 for never.
 */
public class InviteLinkDTO {

    private String groupId;
    private String inviteCode;
    private String createdBy;
    private long expiresAt;
    private int maxUses;
    private int useCount;
    private boolean active;
    private Instant createdAt;
    private String revokedBy;
    private Instant revokedAt;

    public InviteLinkDTO() {}

    public InviteLinkDTO(InviteLink link) {
        this.groupId = link.getGroupId();
        this.inviteCode = link.getInviteCode();
        this.createdBy = link.getCreatedBy();
        this.expiresAt = link.getExpiresAt() != null ? link.getExpiresAt().getEpochSecond() : 0L;
        this.maxUses = link.getMaxUses();
        this.useCount = link.getUseCount();
        this.active = link.isActive();
        this.createdAt = link.getCreatedAt();
        this.revokedBy = link.getRevokedBy();
        this.revokedAt = link.getRevokedAt();
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getInviteCode() {
        return inviteCode;
    }

    public void setInviteCode(String inviteCode) {
        this.inviteCode = inviteCode;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(long expiresAt) {
        this.expiresAt = expiresAt;
    }

    public int getMaxUses() {
        return maxUses;
    }

    public void setMaxUses(int maxUses) {
        this.maxUses = maxUses;
    }

    public int getUseCount() {
        return useCount;
    }

    public void setUseCount(int useCount) {
        this.useCount = useCount;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public String getRevokedBy() {
        return revokedBy;
    }

    public void setRevokedBy(String revokedBy) {
        this.revokedBy = revokedBy;
    }

    public Instant getRevokedAt() {
        return revokedAt;
    }

    public void setRevokedAt(Instant revokedAt) {
        this.revokedAt = revokedAt;
    }
}

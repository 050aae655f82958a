package com.keyregistry.groups.model;

import com.keyregistry.groups.exception.InvalidStateException;
import com.keyregistry.groups.util.InstantAsEpochSecondsAttributeConverter;
import com.keyregistry.groups.util.RecordAddress;
import com.keyregistry.groups.util.RegistryKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * A reusable, bounded invitation into a group.
 *
 * Key Pattern: PK = GROUP#{GroupID}, SK = INVITE#{InviteCode}
 *
 * Once revoked a link stays inactive; nothing sets {@code active} back to true.
 */
@DynamoDbBean
public class InviteLink extends BaseItem {

    private String groupId;
    private String inviteCode;
    private String createdBy;
    private Instant expiresAt;  // null = never expires
    private int maxUses;        // 0 = unlimited
    private int useCount;
    private boolean active;
    private String revokedBy;
    private Instant revokedAt;

    // Default constructor for DynamoDB
    public InviteLink() {
        super();
        setItemType("INVITE_LINK");
    }

    public InviteLink(String groupId, String inviteCode, String createdBy, Instant expiresAt,
                      int maxUses, Instant createdAt) {
        this();
        this.groupId = RegistryKeyFactory.normalizeGroupId(groupId);
        this.inviteCode = inviteCode;
        this.createdBy = createdBy;
        this.expiresAt = expiresAt;
        this.maxUses = maxUses;
        this.useCount = 0;
        this.active = true;
        setCreatedAt(createdAt);
        setUpdatedAt(createdAt);

        applyAddress(deriveAddress());
    }

    @Override
    public RecordAddress deriveAddress() {
        return RegistryKeyFactory.inviteLinkAddress(groupId, inviteCode);
    }

    /**
     * Check, in order, that the link is active, not expired and not used up.
     *
     * @throws InvalidStateException naming the first failed condition
     */
    public void checkRedeemable(Instant now) {
        if (!active) {
            throw new InvalidStateException(InvalidStateException.Reason.INVITE_LINK_INACTIVE,
                "Invite link has been revoked");
        }
        if (isExpiredAt(now)) {
            throw new InvalidStateException(InvalidStateException.Reason.INVITE_LINK_EXPIRED,
                "Invite link expired at " + expiresAt);
        }
        if (isExhausted()) {
            throw new InvalidStateException(InvalidStateException.Reason.INVITE_LINK_EXHAUSTED,
                "Invite link has reached its maximum of " + maxUses + " uses");
        }
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isExhausted() {
        return maxUses != 0 && useCount >= maxUses;
    }

    public void recordUse() {
        this.useCount++;
    }

    public void revoke(String revokedBy, Instant now) {
        if (!active) {
            return;
        }
        this.active = false;
        this.revokedBy = revokedBy;
        this.revokedAt = now;
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

    @DynamoDbConvertedBy(InstantAsEpochSecondsAttributeConverter.class)
    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
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

    public String getRevokedBy() {
        return revokedBy;
    }

    public void setRevokedBy(String revokedBy) {
        this.revokedBy = revokedBy;
    }

    @DynamoDbConvertedBy(InstantAsEpochSecondsAttributeConverter.class)
    public Instant getRevokedAt() {
        return revokedAt;
    }

    public void setRevokedAt(Instant revokedAt) {
        this.revokedAt = revokedAt;
    }
}

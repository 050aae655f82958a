package com.keyregistry.groups.model;

import com.keyregistry.groups.util.InstantAsEpochSecondsAttributeConverter;
import com.keyregistry.groups.util.RecordAddress;
import com.keyregistry.groups.util.RegistryKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * One identity's standing in one group.
 *
 * Key Pattern: PK = GROUP#{GroupID}, SK = MEMBER#{MemberID}
 * GSI Pattern: GSI1PK = MEMBER#{MemberID}, GSI1SK = GROUP#{GroupID}
 */
@DynamoDbBean
public class GroupMembership extends BaseItem {

    private String groupId;
    private String memberId;
    private GroupRole role;
    private int permissions;            // Always role.getPermissions()
    private byte[] encryptedGroupKey;   // Opaque to the registry
    private Instant joinedAt;
    private Instant lastReadAt;
    private boolean isActive;
    private boolean isMuted;
    private boolean isBanned;
    private String invitedBy;           // Audit only
    private String inviteCode;          // Link redeemed to join, if any
    
    // Default constructor for DynamoDB
    public GroupMembership() {
        super();
        setItemType("GROUP_MEMBERSHIP");
    }

    public GroupMembership(String groupId, String memberId, GroupRole role, byte[] encryptedGroupKey,
                           String invitedBy, Instant joinedAt) {
        this();
        this.groupId = RegistryKeyFactory.normalizeGroupId(groupId);
        this.memberId = memberId;
        this.encryptedGroupKey = encryptedGroupKey;
        this.invitedBy = invitedBy;
        this.joinedAt = joinedAt;
        this.isActive = true;
        applyRole(role);
        setCreatedAt(joinedAt);
        setUpdatedAt(joinedAt);

        applyAddress(deriveAddress());
        
        // GSI keys for member -> groups queries
        setGsi1pk(RegistryKeyFactory.getMemberGsi1Pk(memberId));
        setGsi1sk(RegistryKeyFactory.getGroupGsi1Sk(this.groupId));
    }

    @Override
    public RecordAddress deriveAddress() {
        return RegistryKeyFactory.membershipAddress(groupId, memberId);
    }

    /**
     * Set the role and reset the permission mask to the role's fixed mask.
     */
    public void applyRole(GroupRole newRole) {
        this.role = newRole;
        this.permissions = newRole.getPermissions();
    }

    public boolean hasPermission(int permission) {
        return Permission.has(permissions, permission);
    }

    public boolean isOwner() {
        return role == GroupRole.OWNER;
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

    public byte[] getEncryptedGroupKey() {
        return encryptedGroupKey;
    }

    public void setEncryptedGroupKey(byte[] encryptedGroupKey) {
        this.encryptedGroupKey = encryptedGroupKey;
    }

    @DynamoDbConvertedBy(InstantAsEpochSecondsAttributeConverter.class)
    public Instant getJoinedAt() {
        return joinedAt;
    }

    public void setJoinedAt(Instant joinedAt) {
        this.joinedAt = joinedAt;
    }

    @DynamoDbConvertedBy(InstantAsEpochSecondsAttributeConverter.class)
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

    public String getInviteCode() {
        return inviteCode;
    }

    public void setInviteCode(String inviteCode) {
        this.inviteCode = inviteCode;
    }
}

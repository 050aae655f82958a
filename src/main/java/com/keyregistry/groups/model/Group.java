package com.keyregistry.groups.model;

import com.keyregistry.groups.util.RecordAddress;
import com.keyregistry.groups.util.RegistryKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.time.Instant;

/**
 * Group metadata record.
 *
 * Key Pattern: PK = GROUP#{GroupID}, SK = METADATA
 * GSI Pattern: GSI2PK = PUBLIC_GROUPS, GSI2SK = GROUP#{GroupID} while public and searchable
 */
@DynamoDbBean
public class Group extends BaseItem {
    
    private String groupId;
    private String ownerId;
    private String publicCode;  // Null until the owner claims one
    private String name;
    private String description;
    private String avatarRef;
    private boolean isPublic;
    private boolean isSearchable;
    private boolean inviteOnly;
    private boolean requireApproval;
    private boolean allowMemberInvites;
    private boolean enableReplies;
    private boolean enableReactions;
    private boolean enableReadReceipts;
    private boolean enableTypingIndicators;
    private byte[] groupEncryptionKey;
    private int maxMembers;     // 0 = unlimited
    private int memberCount;    // Maintained by every membership transaction, never recounted
    
    // Default constructor for DynamoDB
    public Group() {
        super();
        setItemType("GROUP");
    }

    /**
     * Create a new group owned by its creator, who is counted as the first member.
     */
    public Group(String groupId, String ownerId, String name, String description, Instant createdAt) {
        this();
        this.groupId = RegistryKeyFactory.normalizeGroupId(groupId);
        this.ownerId = ownerId;
        this.name = name;
        this.description = description != null ? description : "";
        this.avatarRef = "";
        this.enableReplies = true;
        this.enableReactions = true;
        this.enableReadReceipts = true;
        this.enableTypingIndicators = true;
        this.memberCount = 1;
        setCreatedAt(createdAt);
        setUpdatedAt(createdAt);
        
        applyAddress(deriveAddress());
        setGsi2sk(RegistryKeyFactory.getGroupGsi1Sk(this.groupId));
    }

    @Override
    public RecordAddress deriveAddress() {
        return RegistryKeyFactory.groupAddress(groupId);
    }

    /**
     * Keep the public group index entry in step with the visibility flags.
     */
    public void refreshDiscoverability() {
        setGsi2pk(isPublic && isSearchable ? RegistryKeyFactory.getPublicGroupGsi2Pk() : null);
    }

    public boolean isOwnedBy(String identity) {
        return ownerId != null && ownerId.equals(identity);
    }

    public boolean hasCapacity() {
        return maxMembers == 0 || memberCount < maxMembers;
    }

    public void incrementMemberCount() {
        this.memberCount++;
    }

    /**
     * Saturating: the count never drops below zero.
     */
    public void decrementMemberCount() {
        if (this.memberCount > 0) {
            this.memberCount--;
        }
    }
    
    public String getGroupId() {
        return groupId;
    }
    
    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getPublicCode() {
        return publicCode;
    }

    public void setPublicCode(String publicCode) {
        this.publicCode = publicCode;
    }
    
    public String getName() {
        return name;
    }
    
    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getAvatarRef() {
        return avatarRef;
    }

    public void setAvatarRef(String avatarRef) {
        this.avatarRef = avatarRef;
    }
    
    public boolean isPublic() {
        return isPublic;
    }
    
    public void setPublic(boolean isPublic) {
        this.isPublic = isPublic;
    }

    public boolean isSearchable() {
        return isSearchable;
    }

    public void setSearchable(boolean isSearchable) {
        this.isSearchable = isSearchable;
    }

    public boolean isInviteOnly() {
        return inviteOnly;
    }

    public void setInviteOnly(boolean inviteOnly) {
        this.inviteOnly = inviteOnly;
    }

    public boolean isRequireApproval() {
        return requireApproval;
    }

    public void setRequireApproval(boolean requireApproval) {
        this.requireApproval = requireApproval;
    }

    public boolean isAllowMemberInvites() {
        return allowMemberInvites;
    }

    public void setAllowMemberInvites(boolean allowMemberInvites) {
        this.allowMemberInvites = allowMemberInvites;
    }

    public boolean isEnableReplies() {
        return enableReplies;
    }

    public void setEnableReplies(boolean enableReplies) {
        this.enableReplies = enableReplies;
    }

    public boolean isEnableReactions() {
        return enableReactions;
    }

    public void setEnableReactions(boolean enableReactions) {
        this.enableReactions = enableReactions;
    }

    public boolean isEnableReadReceipts() {
        return enableReadReceipts;
    }

    public void setEnableReadReceipts(boolean enableReadReceipts) {
        this.enableReadReceipts = enableReadReceipts;
    }

    public boolean isEnableTypingIndicators() {
        return enableTypingIndicators;
    }

    public void setEnableTypingIndicators(boolean enableTypingIndicators) {
        this.enableTypingIndicators = enableTypingIndicators;
    }

    public byte[] getGroupEncryptionKey() {
        return groupEncryptionKey;
    }

    public void setGroupEncryptionKey(byte[] groupEncryptionKey) {
        this.groupEncryptionKey = groupEncryptionKey;
    }

    public int getMaxMembers() {
        return maxMembers;
    }

    public void setMaxMembers(int maxMembers) {
        this.maxMembers = maxMembers;
    }

    public int getMemberCount() {
        return memberCount;
    }

    public void setMemberCount(int memberCount) {
        this.memberCount = memberCount;
    }
}

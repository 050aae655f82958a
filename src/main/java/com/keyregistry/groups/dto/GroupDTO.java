package com.keyregistry.groups.dto;

import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.GroupRole;

import java.time.Instant;

/**
 * Data Transfer Object for Group information.
 * The caller's role and the group encryption key are only filled in for members.
 */
public class GroupDTO {

    private String groupId;
    private String ownerId;
    private String publicCode;
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
    private int maxMembers;
    private int memberCount;
    private byte[] groupEncryptionKey;
    private GroupRole userRole;     // Role of the requesting user in this group
    private Instant joinedAt;       // When the user joined (if applicable)
    private Instant createdAt;
    private Instant updatedAt;

    public GroupDTO() {}

    // Constructor from Group entity (with user membership info)
    public GroupDTO(Group group, GroupMembership membership) {
        this.groupId = group.getGroupId();
        this.ownerId = group.getOwnerId();
        this.publicCode = group.getPublicCode();
        this.name = group.getName();
        this.description = group.getDescription();
        this.avatarRef = group.getAvatarRef();
        this.isPublic = group.isPublic();
        this.isSearchable = group.isSearchable();
        this.inviteOnly = group.isInviteOnly();
        this.requireApproval = group.isRequireApproval();
        this.allowMemberInvites = group.isAllowMemberInvites();
        this.enableReplies = group.isEnableReplies();
        this.enableReactions = group.isEnableReactions();
        this.enableReadReceipts = group.isEnableReadReceipts();
        this.enableTypingIndicators = group.isEnableTypingIndicators();
        this.maxMembers = group.getMaxMembers();
        this.memberCount = group.getMemberCount();
        this.createdAt = group.getCreatedAt();
        this.updatedAt = group.getUpdatedAt();

        if (membership != null) {
            this.groupEncryptionKey = group.getGroupEncryptionKey();
            this.userRole = membership.getRole();
            this.joinedAt = membership.getJoinedAt();
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

    public byte[] getGroupEncryptionKey() {
        return groupEncryptionKey;
    }

    public void setGroupEncryptionKey(byte[] groupEncryptionKey) {
        this.groupEncryptionKey = groupEncryptionKey;
    }

    public GroupRole getUserRole() {
        return userRole;
    }

    public void setUserRole(GroupRole userRole) {
        this.userRole = userRole;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public void setJoinedAt(Instant joinedAt) {
        this.joinedAt = joinedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}

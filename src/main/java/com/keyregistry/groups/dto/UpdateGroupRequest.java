package com.keyregistry.groups.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for updating group settings. Null fields are left unchanged.
 */
public class UpdateGroupRequest {

    @Size(min = 1, max = 100, message = "Group name must be between 1 and 100 characters")
    private String name;

    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;

    @Size(max = 64, message = "Avatar reference must be at most 64 characters")
    private String avatarRef;

    private Boolean isPublic;
    private Boolean isSearchable;
    private Boolean inviteOnly;
    private Boolean requireApproval;
    private Boolean allowMemberInvites;
    private Boolean enableReplies;
    private Boolean enableReactions;
    private Boolean enableReadReceipts;
    private Boolean enableTypingIndicators;

    @Min(value = 0, message = "Max members cannot be negative")
    @Max(value = 65535, message = "Max members must be at most 65535")
    private Integer maxMembers;

    public UpdateGroupRequest() {}

    public boolean hasUpdates() {
        return name != null || description != null || avatarRef != null || isPublic != null
            || isSearchable != null || inviteOnly != null || requireApproval != null
            || allowMemberInvites != null || enableReplies != null || enableReactions != null
            || enableReadReceipts != null || enableTypingIndicators != null || maxMembers != null;
    }

    public String getName() {
        return name != null ? name.trim() : null;
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

    @JsonProperty("public")
    public Boolean isPublic() {
        return isPublic;
    }

    public void setPublic(Boolean isPublic) {
        this.isPublic = isPublic;
    }

    @JsonProperty("searchable")
    public Boolean isSearchable() {
        return isSearchable;
    }

    public void setSearchable(Boolean isSearchable) {
        this.isSearchable = isSearchable;
    }

    public Boolean getInviteOnly() {
        return inviteOnly;
    }

    public void setInviteOnly(Boolean inviteOnly) {
        this.inviteOnly = inviteOnly;
    }

    public Boolean getRequireApproval() {
        return requireApproval;
    }

    public void setRequireApproval(Boolean requireApproval) {
        this.requireApproval = requireApproval;
    }

    public Boolean getAllowMemberInvites() {
        return allowMemberInvites;
    }

    public void setAllowMemberInvites(Boolean allowMemberInvites) {
        this.allowMemberInvites = allowMemberInvites;
    }

    public Boolean getEnableReplies() {
        return enableReplies;
    }

    public void setEnableReplies(Boolean enableReplies) {
        this.enableReplies = enableReplies;
    }

    public Boolean getEnableReactions() {
        return enableReactions;
    }

    public void setEnableReactions(Boolean enableReactions) {
        this.enableReactions = enableReactions;
    }

    public Boolean getEnableReadReceipts() {
        return enableReadReceipts;
    }

    public void setEnableReadReceipts(Boolean enableReadReceipts) {
        this.enableReadReceipts = enableReadReceipts;
    }

    public Boolean getEnableTypingIndicators() {
        return enableTypingIndicators;
    }

    public void setEnableTypingIndicators(Boolean enableTypingIndicators) {
        this.enableTypingIndicators = enableTypingIndicators;
    }

    public Integer getMaxMembers() {
        return maxMembers;
    }

    public void setMaxMembers(Integer maxMembers) {
        this.maxMembers = maxMembers;
    }
}

package com.keyregistry.groups.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for adding a member directly.
 */
public class InviteMemberRequest {

    @NotBlank(message = "Member ID is required")
    private String memberId;

    @NotNull(message = "Encrypted group key is required")
    private byte[] encryptedGroupKey;

    public InviteMemberRequest() {}

    public InviteMemberRequest(String memberId, byte[] encryptedGroupKey) {
        this.memberId = memberId;
        this.encryptedGroupKey = encryptedGroupKey;
    }

    public String getMemberId() {
        return memberId;
    }

    public void setMemberId(String memberId) {
        this.memberId = memberId;
    }

    public byte[] getEncryptedGroupKey() {
        return encryptedGroupKey;
    }

    public void setEncryptedGroupKey(byte[] encryptedGroupKey) {
        this.encryptedGroupKey = encryptedGroupKey;
    }
}

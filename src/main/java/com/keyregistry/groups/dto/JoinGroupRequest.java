package com.keyregistry.groups.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for joining a group, openly or through an invite link.
 */
public class JoinGroupRequest {

    @NotNull(message = "Encrypted group key is required")
    private byte[] encryptedGroupKey;

    public JoinGroupRequest() {}

    public JoinGroupRequest(byte[] encryptedGroupKey) {
        this.encryptedGroupKey = encryptedGroupKey;
    }

    public byte[] getEncryptedGroupKey() {
        return encryptedGroupKey;
    }

    public void setEncryptedGroupKey(byte[] encryptedGroupKey) {
        this.encryptedGroupKey = encryptedGroupKey;
    }
}

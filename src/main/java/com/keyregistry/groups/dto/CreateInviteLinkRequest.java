package com.keyregistry.groups.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request DTO for creating an invite link.
 * A null code asks the server to generate one. Expiry is in epoch seconds, 0 or null for never.
 */
public class CreateInviteLinkRequest {

    private String code;

    @PositiveOrZero(message = "Expiry cannot be negative")
    private Long expiresAt;

    @Min(value = 0, message = "Max uses cannot be negative")
    @Max(value = 65535, message = "Max uses must be at most 65535")
    private Integer maxUses;

    public CreateInviteLinkRequest() {}

    public CreateInviteLinkRequest(String code, Long expiresAt, Integer maxUses) {
        this.code = code;
        this.expiresAt = expiresAt;
        this.maxUses = maxUses;
    }

    public String getCode() {
        return code != null ? code.trim() : null;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public Long getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Long expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Integer getMaxUses() {
        return maxUses;
    }

    public void setMaxUses(Integer maxUses) {
        this.maxUses = maxUses;
    }
}

package com.keyregistry.groups.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for claiming a group's public code.
 */
public class SetGroupCodeRequest {

    @NotBlank(message = "Code is required")
    private String code;

    public SetGroupCodeRequest() {}

    public SetGroupCodeRequest(String code) {
        this.code = code;
    }

    public String getCode() {
        return code != null ? code.trim() : null;
    }

    public void setCode(String code) {
        this.code = code;
    }
}

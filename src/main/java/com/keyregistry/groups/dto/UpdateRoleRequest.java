package com.keyregistry.groups.dto;

import com.keyregistry.groups.model.GroupRole;
import jakarta.validation.constraints.NotNull;

public class UpdateRoleRequest {

    @NotNull(message = "Role is required")
    private GroupRole role;

    public UpdateRoleRequest() {}

    public UpdateRoleRequest(GroupRole role) {
        this.role = role;
    }

    public GroupRole getRole() {
        return role;
    }

    public void setRole(GroupRole role) {
        this.role = role;
    }
}

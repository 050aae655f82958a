package com.keyregistry.groups.service;

import com.keyregistry.groups.dto.CreateGroupRequest;
import com.keyregistry.groups.dto.GroupDTO;
import com.keyregistry.groups.dto.UpdateGroupRequest;

import java.util.List;

/**
 * Service interface for the group lifecycle: creation, public codes and settings.
 */
public interface GroupService {

    /**
     * Create a new group with the creator as its owner and first member.
     * Both records are written in one transaction; a reused group ID fails with AlreadyExists.
     */
    GroupDTO createGroup(CreateGroupRequest request, String creatorId);

    /**
     * Claim a public code for a group (stored owner only).
     * The code lookup and the group's publicCode field are written together.
     */
    GroupDTO setGroupCode(String groupId, String code, String requestingUserId);

    /**
     * Partially update group settings (owner or admin).
     * Only provided fields in the request will be updated.
     */
    GroupDTO updateGroupSettings(String groupId, UpdateGroupRequest request, String requestingUserId);

    /**
     * Get group details. Private groups are visible to members only.
     */
    GroupDTO getGroup(String groupId, String requestingUserId);

    /**
     * Get all groups a user belongs to, via the UserGroupIndex.
     */
    List<GroupDTO> getUserGroups(String userId);

    /**
     * Public, searchable groups whose name contains the query, ignoring case.
     */
    List<GroupDTO> searchPublicGroups(String query);
}

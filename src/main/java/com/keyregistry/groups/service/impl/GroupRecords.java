package com.keyregistry.groups.service.impl;

import com.keyregistry.groups.exception.PermissionDeniedException;
import com.keyregistry.groups.exception.ResourceNotFoundException;
import com.keyregistry.groups.exception.ValidationException;
import com.keyregistry.groups.model.CodeLookup;
import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.repository.GroupRepository;
import com.keyregistry.groups.util.GroupValidationRules;

import java.util.Locale;

/**
 * Record loading shared by the service implementations.
 */
final class GroupRecords {

    private GroupRecords() {
        throw new UnsupportedOperationException("Utility class");
    }

    static Group requireGroup(GroupRepository repository, String groupId) {
        return repository.findGroup(groupId)
            .orElseThrow(() -> new ResourceNotFoundException("Group not found: " + groupId));
    }

    /**
     * Resolve a public code to its group: lowercase, validate, then read the code lookup and the group.
     */
    static Group requireGroupByCode(GroupRepository repository, String code) {
        if (code == null) {
            throw new ValidationException("publicCode", "Public code is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        GroupValidationRules.validatePublicCode(normalized);

        CodeLookup lookup = repository.findCodeLookup(normalized)
            .orElseThrow(() -> new ResourceNotFoundException("No group found for code: " + normalized));
        return repository.findGroup(lookup.getGroupId())
            .orElseThrow(() -> new ResourceNotFoundException("Group not found for code: " + normalized));
    }

    static GroupMembership requireMember(GroupRepository repository, String groupId, String memberId) {
        return repository.findMembership(groupId, memberId)
            .orElseThrow(() -> new ResourceNotFoundException("Member " + memberId + " not found in group " + groupId));
    }

    /**
     * The caller's own membership; a caller outside the group is refused rather than told "not found".
     */
    static GroupMembership requireCaller(GroupRepository repository, String groupId, String callerId) {
        return repository.findMembership(groupId, callerId)
            .orElseThrow(() -> new PermissionDeniedException(PermissionDeniedException.Reason.NOT_A_MEMBER,
                "User is not a member of group " + groupId));
    }

    /**
     * Public groups can be read by anyone authenticated; private groups only by members.
     */
    static void requireVisible(Group group, GroupMembership callerMembership) {
        if (!group.isPublic() && callerMembership == null) {
            throw new PermissionDeniedException(PermissionDeniedException.Reason.NOT_A_MEMBER,
                "Group " + group.getGroupId() + " is private");
        }
    }
}

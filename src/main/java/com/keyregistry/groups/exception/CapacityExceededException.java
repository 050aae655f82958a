package com.keyregistry.groups.exception;

/**
 * Exception thrown when admitting a member would exceed the group's max-members cap.
 *
 * This is a 409 Conflict error indicating the resource state prevents the operation.
 */
public class CapacityExceededException extends RuntimeException {

    private final String groupId;
    private final int maxMembers;

    public CapacityExceededException(String groupId, int maxMembers) {
        super("Group " + groupId + " is full (max members: " + maxMembers + ")");
        this.groupId = groupId;
        this.maxMembers = maxMembers;
    }

    public String getGroupId() {
        return groupId;
    }

    public int getMaxMembers() {
        return maxMembers;
    }
}

package com.keyregistry.groups.exception;

/**
 * Exception thrown when the caller's standing in a group does not allow the operation.
 */
public class PermissionDeniedException extends RuntimeException {

    public enum Reason {
        NOT_A_MEMBER,
        NOT_GROUP_OWNER,
        INSUFFICIENT_ROLE,
        INSUFFICIENT_RANK,
        MEMBER_INVITES_DISABLED
    }

    private final Reason reason;

    public PermissionDeniedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}

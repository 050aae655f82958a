package com.keyregistry.groups.exception;

/**
 * Exception thrown when a record's current state rules out the operation,
 * independent of who is asking.
 */
public class InvalidStateException extends RuntimeException {

    public enum Reason {
        OWNER_CANNOT_LEAVE,
        CANNOT_KICK_OWNER,
        CANNOT_KICK_SELF,
        CANNOT_CHANGE_OWNER_ROLE,
        CANNOT_ASSIGN_OWNER,
        INVITE_LINK_INACTIVE,
        INVITE_LINK_EXPIRED,
        INVITE_LINK_EXHAUSTED,
        MAX_MEMBERS_BELOW_COUNT
    }

    private final Reason reason;

    public InvalidStateException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}

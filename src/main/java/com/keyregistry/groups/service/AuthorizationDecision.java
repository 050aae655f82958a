package com.keyregistry.groups.service;

import com.keyregistry.groups.exception.InvalidStateException;
import com.keyregistry.groups.exception.PermissionDeniedException;

/**
 * Outcome of a policy evaluation. A refusal is either a permission denial (the caller lacks
 * standing) or a state violation (no caller could do this to this target).
 */
public final class AuthorizationDecision {

    private static final AuthorizationDecision ALLOWED = new AuthorizationDecision(null, null, null);

    private final PermissionDeniedException.Reason denialReason;
    private final InvalidStateException.Reason violationReason;
    private final String message;

    private AuthorizationDecision(PermissionDeniedException.Reason denialReason,
                                  InvalidStateException.Reason violationReason, String message) {
        this.denialReason = denialReason;
        this.violationReason = violationReason;
        this.message = message;
    }

    public static AuthorizationDecision allow() {
        return ALLOWED;
    }

    public static AuthorizationDecision deny(PermissionDeniedException.Reason reason, String message) {
        return new AuthorizationDecision(reason, null, message);
    }

    public static AuthorizationDecision violation(InvalidStateException.Reason reason, String message) {
        return new AuthorizationDecision(null, reason, message);
    }

    public boolean isAllowed() {
        return denialReason == null && violationReason == null;
    }

    public PermissionDeniedException.Reason getDenialReason() {
        return denialReason;
    }

    public InvalidStateException.Reason getViolationReason() {
        return violationReason;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Throw the exception this decision stands for; return normally when allowed.
     */
    public void enforce() {
        if (denialReason != null) {
            throw new PermissionDeniedException(denialReason, message);
        }
        if (violationReason != null) {
            throw new InvalidStateException(violationReason, message);
        }
    }

    @Override
    public String toString() {
        if (isAllowed()) {
            return "ALLOW";
        }
        return "DENY(" + (denialReason != null ? denialReason : violationReason) + ": " + message + ")";
    }
}

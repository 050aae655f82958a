package com.keyregistry.groups.service;

/**
 * Single decision point for every membership-sensitive action.
 * Implementations are pure: no storage access, no side effects.
 */
public interface GroupAuthorizationPolicy {

    AuthorizationDecision evaluate(AuthorizationRequest request);

    default boolean canPerform(AuthorizationRequest request) {
        return evaluate(request).isAllowed();
    }

    /**
     * Evaluate and throw if refused.
     */
    default void authorize(AuthorizationRequest request) {
        evaluate(request).enforce();
    }
}

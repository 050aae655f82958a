package com.keyregistry.groups.model;

/**
 * Actions a member can attempt inside a group.
 */
public enum GroupAction {
    INVITE_MEMBER,
    CREATE_INVITE_LINK,
    LIST_INVITE_LINKS,
    REVOKE_INVITE_LINK,
    KICK_MEMBER,
    UPDATE_ROLE,
    UPDATE_SETTINGS,
    LEAVE
}

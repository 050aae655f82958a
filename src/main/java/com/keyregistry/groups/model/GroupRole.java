package com.keyregistry.groups.model;

/**
 * Membership roles, totally ordered by rank.
 * Rank decides who may act on whom; the permission mask decides what a role may do.
 */
public enum GroupRole {

    MEMBER(0, Permission.SEND_MESSAGES),
    MODERATOR(1, Permission.SEND_MESSAGES | Permission.INVITE_MEMBERS | Permission.KICK_MEMBERS),
    ADMIN(2, Permission.SEND_MESSAGES | Permission.INVITE_MEMBERS | Permission.KICK_MEMBERS
        | Permission.MANAGE_ROLES),
    OWNER(3, Permission.ALL);

    private final int rank;
    private final int permissions;

    GroupRole(int rank, int permissions) {
        this.rank = rank;
        this.permissions = permissions;
    }

    public int getRank() {
        return rank;
    }

    public int getPermissions() {
        return permissions;
    }

    public boolean outranks(GroupRole other) {
        return this.rank > other.rank;
    }

    /**
     * Owner, admin and moderator: the roles that may invite and kick.
     */
    public boolean isStaff() {
        return this != MEMBER;
    }
}

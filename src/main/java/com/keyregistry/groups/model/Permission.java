package com.keyregistry.groups.model;

/**
 * Permission bits carried on a membership.
 * A membership's mask is always the fixed mask of its role; there are no per-member overrides.
 */
public final class Permission {

    public static final int SEND_MESSAGES = 1;
    public static final int INVITE_MEMBERS = 1 << 1;
    public static final int KICK_MEMBERS = 1 << 2;
    public static final int MANAGE_SETTINGS = 1 << 3;
    public static final int DELETE_MESSAGES = 1 << 4;
    public static final int PIN_MESSAGES = 1 << 5;
    public static final int MANAGE_ROLES = 1 << 6;

    /** Every bit of the 16-bit mask. */
    public static final int ALL = 0xFFFF;

    private Permission() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static boolean has(int mask, int permission) {
        return (mask & permission) == permission;
    }
}

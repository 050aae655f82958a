package com.keyregistry.groups.util;

import com.keyregistry.groups.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Field-level shape checks. Pure and stateless: every check runs before any record is
 * read or written, and a failure names the offending field.
 */
public final class GroupValidationRules {

    public static final int MAX_GROUP_NAME_LENGTH = 100;
    public static final int MAX_DESCRIPTION_LENGTH = 500;
    public static final int MAX_AVATAR_REF_LENGTH = 64;
    public static final int MIN_PUBLIC_CODE_LENGTH = 3;
    public static final int MAX_PUBLIC_CODE_LENGTH = 20;
    public static final int MIN_INVITE_CODE_LENGTH = 8;
    public static final int MAX_INVITE_CODE_LENGTH = 16;
    public static final int MIN_USERNAME_LENGTH = 3;
    public static final int MAX_USERNAME_LENGTH = 20;
    public static final int MAX_U16 = 0xFFFF;
    public static final int GROUP_KEY_BYTES = 32;
    public static final int MEMBER_KEY_BYTES = 64;

    private static final Pattern PUBLIC_CODE_CHARS = Pattern.compile("[a-z0-9-]+");
    private static final Pattern INVITE_CODE_CHARS = Pattern.compile("[A-Za-z0-9]+");
    private static final Pattern USERNAME_CHARS = Pattern.compile("[A-Za-z0-9_]+");

    private GroupValidationRules() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static void validateGroupName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "Group name must be 1-100 characters");
        }
        if (length(name) > MAX_GROUP_NAME_LENGTH) {
            throw new ValidationException("name", "Group name must be 1-100 characters");
        }
    }

    public static void validateDescription(String description) {
        if (description != null && length(description) > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("description", "Group description must be 0-500 characters");
        }
    }

    public static void validateAvatarRef(String avatarRef) {
        if (avatarRef != null && length(avatarRef) > MAX_AVATAR_REF_LENGTH) {
            throw new ValidationException("avatarRef", "Avatar reference must be at most 64 characters");
        }
    }

    public static void validatePublicCode(String code) {
        if (code == null || code.length() < MIN_PUBLIC_CODE_LENGTH || code.length() > MAX_PUBLIC_CODE_LENGTH) {
            throw new ValidationException("publicCode", "Public code must be 3-20 characters");
        }
        if (!PUBLIC_CODE_CHARS.matcher(code).matches()) {
            throw new ValidationException("publicCode",
                "Public code can only contain lowercase letters, numbers, and hyphens");
        }
    }

    public static void validateInviteCode(String code) {
        if (code == null || code.length() < MIN_INVITE_CODE_LENGTH || code.length() > MAX_INVITE_CODE_LENGTH) {
            throw new ValidationException("inviteCode", "Invite code must be 8-16 characters");
        }
        if (!INVITE_CODE_CHARS.matcher(code).matches()) {
            throw new ValidationException("inviteCode", "Invite code can only contain alphanumeric characters");
        }
    }

    /**
     * Username shape as enforced by the external username registry.
     */
    public static void validateUsername(String username) {
        if (username == null || username.length() < MIN_USERNAME_LENGTH || username.length() > MAX_USERNAME_LENGTH) {
            throw new ValidationException("username", "Username must be 3-20 characters");
        }
        if (!USERNAME_CHARS.matcher(username).matches()) {
            throw new ValidationException("username",
                "Username can only contain letters, numbers, and underscores");
        }
    }

    public static void validateMaxMembers(int maxMembers) {
        if (maxMembers < 0 || maxMembers > MAX_U16) {
            throw new ValidationException("maxMembers", "Max members must be between 0 and 65535");
        }
    }

    public static void validateMaxUses(int maxUses) {
        if (maxUses < 0 || maxUses > MAX_U16) {
            throw new ValidationException("maxUses", "Max uses must be between 0 and 65535");
        }
    }

    public static void validateGroupEncryptionKey(byte[] key) {
        if (key == null || key.length != GROUP_KEY_BYTES) {
            throw new ValidationException("groupEncryptionKey", "Group encryption key must be exactly 32 bytes");
        }
    }

    public static void validateEncryptedMemberKey(byte[] key) {
        if (key == null || key.length != MEMBER_KEY_BYTES) {
            throw new ValidationException("encryptedGroupKey", "Encrypted group key must be exactly 64 bytes");
        }
    }

    private static int length(String value) {
        return value.codePointCount(0, value.length());
    }
}

package com.keyregistry.groups.util;

import com.keyregistry.groups.exception.InvalidKeyException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Type-safe key factory for the GroupRegistryTable single-table design.
 * Every record address is a pure function of the record's logical key; nothing else
 * may pick where a record lives.
 *
 * Key patterns:
 *   Group       PK = GROUP#{groupId}     SK = METADATA
 *   Membership  PK = GROUP#{groupId}     SK = MEMBER#{memberId}
 *   InviteLink  PK = GROUP#{groupId}     SK = INVITE#{inviteCode}
 *   CodeLookup  PK = CODE#{publicCode}   SK = METADATA
 */
public final class RegistryKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern GROUP_ID_PATTERN = Pattern.compile("[0-9a-fA-F]{64}");
    private static final Pattern IDENTITY_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final Pattern INVITE_CODE_PATTERN = Pattern.compile("[A-Za-z0-9]{1,16}");
    private static final Pattern PUBLIC_CODE_PATTERN = Pattern.compile("[a-z0-9-]{1,20}");

    public static final String GROUP_PREFIX = "GROUP";
    public static final String MEMBER_PREFIX = "MEMBER";
    public static final String INVITE_PREFIX = "INVITE";
    public static final String CODE_PREFIX = "CODE";
    public static final String METADATA_SUFFIX = "METADATA";
    public static final String PUBLIC_GROUPS_PARTITION = "PUBLIC_GROUPS";

    // Proof seeds, one per record type
    private static final String GROUP_SEED = "group";
    private static final String MEMBER_SEED = "group:member";
    private static final String INVITE_SEED = "group:invite";
    private static final String CODE_SEED = "group:code";

    private RegistryKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    // Component validation

    /**
     * Canonical form of a 32-byte group identifier: 64 lowercase hex characters.
     */
    public static String normalizeGroupId(String groupId) {
        if (groupId == null || !GROUP_ID_PATTERN.matcher(groupId).matches()) {
            throw new InvalidKeyException("Invalid group ID format: " + groupId);
        }
        return groupId.toLowerCase(Locale.ROOT);
    }

    /**
     * Public codes are case-folded before any address is derived from them.
     */
    public static String normalizePublicCode(String publicCode) {
        if (publicCode == null || publicCode.isEmpty()) {
            throw new InvalidKeyException("Public code cannot be null or empty");
        }
        return publicCode.toLowerCase(Locale.ROOT);
    }

    private static void validateIdentity(String identity, String type) {
        if (identity == null || !IDENTITY_PATTERN.matcher(identity).matches()) {
            throw new InvalidKeyException("Invalid " + type + " identity: " + identity);
        }
    }

    private static void validateInviteCode(String inviteCode) {
        if (inviteCode == null || !INVITE_CODE_PATTERN.matcher(inviteCode).matches()) {
            throw new InvalidKeyException("Invalid invite code: " + inviteCode);
        }
    }

    private static String validatePublicCode(String publicCode) {
        String normalized = normalizePublicCode(publicCode);
        if (!PUBLIC_CODE_PATTERN.matcher(normalized).matches()) {
            throw new InvalidKeyException("Invalid public code: " + publicCode);
        }
        return normalized;
    }

    // Addresses

    public static RecordAddress groupAddress(String groupId) {
        String id = normalizeGroupId(groupId);
        return new RecordAddress(
            GROUP_PREFIX + DELIMITER + id,
            METADATA_SUFFIX,
            proof(GROUP_SEED, HexFormat.of().parseHex(id)));
    }

    public static RecordAddress membershipAddress(String groupId, String memberId) {
        String id = normalizeGroupId(groupId);
        validateIdentity(memberId, "Member");
        return new RecordAddress(
            GROUP_PREFIX + DELIMITER + id,
            MEMBER_PREFIX + DELIMITER + memberId,
            proof(MEMBER_SEED, HexFormat.of().parseHex(id), utf8(memberId)));
    }

    public static RecordAddress inviteLinkAddress(String groupId, String inviteCode) {
        String id = normalizeGroupId(groupId);
        validateInviteCode(inviteCode);
        return new RecordAddress(
            GROUP_PREFIX + DELIMITER + id,
            INVITE_PREFIX + DELIMITER + inviteCode,
            proof(INVITE_SEED, HexFormat.of().parseHex(id), utf8(inviteCode)));
    }

    public static RecordAddress codeLookupAddress(String publicCode) {
        String code = validatePublicCode(publicCode);
        return new RecordAddress(
            CODE_PREFIX + DELIMITER + code,
            METADATA_SUFFIX,
            proof(CODE_SEED, utf8(code)));
    }

    // Raw key components for queries

    public static String getGroupPk(String groupId) {
        return GROUP_PREFIX + DELIMITER + normalizeGroupId(groupId);
    }

    public static String getMemberQueryPrefix() {
        return MEMBER_PREFIX + DELIMITER;
    }

    public static String getInviteQueryPrefix() {
        return INVITE_PREFIX + DELIMITER;
    }

    // GSI Keys
    public static String getMemberGsi1Pk(String memberId) {
        validateIdentity(memberId, "Member");
        return MEMBER_PREFIX + DELIMITER + memberId;
    }

    public static String getGroupGsi1Sk(String groupId) {
        return GROUP_PREFIX + DELIMITER + normalizeGroupId(groupId);
    }

    public static String getPublicGroupGsi2Pk() {
        return PUBLIC_GROUPS_PARTITION;
    }

    /**
     * SHA-256 over the seed and every component, each prefixed with its length so that
     * no two component lists hash the same input.
     */
    private static String proof(String seed, byte[]... components) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] seedBytes = utf8(seed);
            digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(seedBytes.length).array());
            digest.update(seedBytes);
            for (byte[] component : components) {
                digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(component.length).array());
                digest.update(component);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}

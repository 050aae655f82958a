package com.keyregistry.groups.util;

import java.security.SecureRandom;
import java.util.function.Predicate;

/**
 * Generates invite link codes for callers that do not choose their own.
 */
public final class InviteCodeGenerator {

    private static final String CHARACTERS = "ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz23456789";
    private static final int CODE_LENGTH = 12;
    private static final int MAX_ATTEMPTS = 10;
    private static final SecureRandom random = new SecureRandom();

    private InviteCodeGenerator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Generate a random invite code.
     * Format: 12 alphanumeric characters without look-alikes (0/O, 1/l/I).
     */
    public static String generate() {
        StringBuilder code = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            code.append(CHARACTERS.charAt(random.nextInt(CHARACTERS.length())));
        }
        return code.toString();
    }

    /**
     * Generate a code the checker reports as free. The create itself still fails on an
     * occupied address, so this only keeps collisions away from the caller.
     *
     * @param existsChecker returns true if a code is already taken
     * @throws IllegalStateException if no free code was found in a bounded number of attempts
     */
    public static String generateUnique(Predicate<String> existsChecker) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String code = generate();
            if (!existsChecker.test(code)) {
                return code;
            }
        }
        throw new IllegalStateException("Could not generate a free invite code after " + MAX_ATTEMPTS + " attempts");
    }
}

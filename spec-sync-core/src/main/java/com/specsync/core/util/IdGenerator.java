package com.specsync.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Generates deterministic identifiers from stable inputs.
 *
 * <p>Identifiers are the first 16 hex characters of a SHA-256 digest, so the same
 * module name always maps to the same component id across runs.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String id = IdGenerator.generate("MyApp.Accounts");
 * }</pre>
 */
public final class IdGenerator {

    private static final int ID_LENGTH = 16;
    private static final String SEPARATOR = ":";

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates an id from one or more components joined with {@code ':'}.
     *
     * @param components id components
     * @return 16 character lowercase hex id
     * @throws IllegalArgumentException if no components are given
     */
    public static String generate(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        return sha256Hex(String.join(SEPARATOR, components)).substring(0, ID_LENGTH);
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

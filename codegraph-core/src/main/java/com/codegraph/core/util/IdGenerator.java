package com.codegraph.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Generates deterministic identifiers from SHA-256 digests.
 *
 * <p>The same components always produce the same id, which keeps entity and relation
 * ids stable across re-analysis of unchanged source.
 *
 * <pre>{@code
 * String id = IdGenerator.generate(projectId, "pkg.a.foo", "pkg/a.py");
 * }</pre>
 */
public final class IdGenerator {

    private static final int SHORT_ID_LENGTH = 16;
    private static final String SEPARATOR = "\u0000";

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a 16-character hex id from the given components.
     *
     * @param components identifying components, joined with a separator that cannot occur in names
     * @return deterministic id
     * @throws IllegalArgumentException if no component is given
     */
    public static String generate(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < components.length; i++) {
            if (i > 0) {
                joined.append(SEPARATOR);
            }
            joined.append(components[i] == null ? "" : components[i]);
        }
        return sha256(joined.toString()).substring(0, SHORT_ID_LENGTH);
    }

    /**
     * Generates a 16-character hex id from a single string.
     *
     * @param input non-blank input
     * @return deterministic id
     * @throws IllegalArgumentException if input is null or blank
     */
    public static String generateFromString(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Input must not be null or blank");
        }
        return sha256(input).substring(0, SHORT_ID_LENGTH);
    }

    /**
     * Returns the full 64-character SHA-256 hex digest of the input.
     *
     * @param input non-blank input
     * @return lowercase hex digest
     */
    public static String generateFullHash(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Input must not be null or blank");
        }
        return sha256(input);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.provider.linkage.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic organization identifiers.
 *
 * <p>Registry-backed organizations are keyed by their primary identifier. Organizations known
 * only by name are keyed by a SHA-256 digest of {@code normalizedName|stateCode}, so the same
 * input always yields the same id across runs and machines.</p>
 */
public final class OrgIdGenerator {

    public static final String PREFIX = "org_";
    static final int HASH_LENGTH = 16;

    private OrgIdGenerator() {
    }

    public static String forPrimaryIdentifier(String primaryIdentifier) {
        if (primaryIdentifier == null || primaryIdentifier.isBlank()) {
            throw new IllegalArgumentException("primaryIdentifier is required");
        }
        return PREFIX + primaryIdentifier.trim();
    }

    public static String forNameAndState(String normalizedName, String stateCode) {
        String name = normalizedName != null ? normalizedName : "";
        String state = stateCode != null ? stateCode : "";
        return PREFIX + stableHash(name + "|" + state);
    }

    /**
     * First 16 hex characters of the SHA-256 digest of the UTF-8 bytes of {@code key}.
     */
    public static String stableHash(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

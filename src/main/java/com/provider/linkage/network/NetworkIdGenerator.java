package com.provider.linkage.network;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Network ids: {@code net_} followed by the first 12 hex characters of the MD5 of the
 * normalized network name.
 */
public final class NetworkIdGenerator {

    public static final String PREFIX = "net_";
    private static final int HASH_LENGTH = 12;

    private NetworkIdGenerator() {
    }

    public static String forName(String normalizedName) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] hash = md5.digest(normalizedName.getBytes(StandardCharsets.UTF_8));
            return PREFIX + HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}

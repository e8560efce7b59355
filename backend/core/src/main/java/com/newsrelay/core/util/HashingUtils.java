package com.newsrelay.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class HashingUtils {
    public static final int FINGERPRINT_LENGTH = 16;

    private HashingUtils() {
    }

    public static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Stable article identity: the first {@value #FINGERPRINT_LENGTH} hex chars of
     * {@code sha256(title + "_" + link)}. Both parts are trimmed first.
     */
    public static String fingerprint(String title, String link) {
        String normalizedTitle = title == null ? "" : title.trim();
        String normalizedLink = link == null ? "" : link.trim();
        return sha256(normalizedTitle + "_" + normalizedLink).substring(0, FINGERPRINT_LENGTH);
    }
}

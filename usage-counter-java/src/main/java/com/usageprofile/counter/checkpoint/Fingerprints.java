package com.usageprofile.counter.checkpoint;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for content fingerprints, record names and analysis keys.
 */
public final class Fingerprints {

    private static final String PREFIX = "sha256:";

    private Fingerprints() {}

    /** Content fingerprint of a source file, e.g. {@code sha256:9f86d0...}. */
    public static String ofContent(byte[] content) {
        return PREFIX + sha256Hex(content);
    }

    public static String sha256Hex(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Key identifying the analysis that produced a record: the API description bytes
     * together with the options that change what a file contributes.
     */
    public static String analysisKey(byte[] apiDescription, String optionsFingerprint) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(apiDescription);
            digest.update((byte) 0);
            digest.update(optionsFingerprint.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

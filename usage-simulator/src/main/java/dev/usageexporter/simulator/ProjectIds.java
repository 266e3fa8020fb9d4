package dev.usageexporter.simulator;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic ids for simulated projects and domains that do not declare one:
 * the last 16 hex characters of the SHA-256 of the name.
 */
final class ProjectIds {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private ProjectIds() {
    }

    static String fromName(String name) {
        byte[] digest;
        try {
            digest = MessageDigest.getInstance("SHA-256").digest(name.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        StringBuilder hex = new StringBuilder(digest.length * 2);
        for (byte b : digest) {
            hex.append(HEX[(b >> 4) & 0xf]).append(HEX[b & 0xf]);
        }
        return hex.substring(hex.length() - 16);
    }
}

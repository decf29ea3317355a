/**
 * Deterministic cache key construction
 *
 * @author William Callahan
 *
 * Features:
 * - Keys are a hash of (user fingerprint, artifact class, parameters), never the raw credential
 * - User fingerprints are a one-way hash of the library credential
 * - Shared artifacts use a fixed wildcard fingerprint so every user hits the same entry
 */

package com.williamcallahan.media_recommendation_engine.util;

import com.williamcallahan.media_recommendation_engine.model.ArtifactClass;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class CacheKeyUtils {

    /** Fingerprint used for artifacts shared across users */
    public static final String SHARED_FINGERPRINT = "*";

    private static final String SEPARATOR = "|";

    private CacheKeyUtils() {
    }

    /**
     * One-way fingerprint of a user credential
     */
    public static String fingerprint(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new IllegalArgumentException("Credential must not be blank");
        }
        return sha256Hex(credential.trim()).substring(0, 32);
    }

    /**
     * Cache key for an artifact. Parameters are joined in order, so callers must pass them
     * in a stable order.
     */
    public static String key(String prefix, ArtifactClass artifactClass, String fingerprint, Object... params) {
        StringBuilder material = new StringBuilder(fingerprint).append(SEPARATOR).append(artifactClass.getKeySegment());
        for (Object param : params) {
            material.append(SEPARATOR).append(param == null ? "" : param.toString());
        }
        return prefix + ":" + artifactClass.getKeySegment() + ":" + sha256Hex(material.toString());
    }

    public static String lockKey(String key) {
        return "lock:" + key;
    }

    /**
     * Short prefix of a fingerprint, safe to log
     */
    public static String logSafe(String fingerprint) {
        if (fingerprint == null) {
            return "unknown";
        }
        return fingerprint.length() <= 8 ? fingerprint : fingerprint.substring(0, 8);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

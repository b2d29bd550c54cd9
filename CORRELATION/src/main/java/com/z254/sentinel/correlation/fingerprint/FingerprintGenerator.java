package com.z254.sentinel.correlation.fingerprint;

import com.z254.sentinel.correlation.domain.model.Incident;
import com.z254.sentinel.correlation.domain.model.Resource;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Deterministic incident fingerprints.
 * <p>
 * The fingerprint is the lower-case hex SHA-256 of the normalized source, category,
 * resource type, resource id and title, joined by the unit separator. Description,
 * severity, labels and timestamps do not contribute.
 */
public final class FingerprintGenerator {

    private static final char SEPARATOR = '\u001F';

    private FingerprintGenerator() {
    }

    public static String fingerprint(Incident incident) {
        Resource resource = incident.getResource();
        String canonical = normalize(incident.getSource())
                + SEPARATOR + normalize(incident.getCategory())
                + SEPARATOR + normalize(resource != null ? resource.type() : null)
                + SEPARATOR + normalize(resource != null ? resource.id() : null)
                + SEPARATOR + normalizeTitle(incident.getTitle());
        return sha256(canonical);
    }

    /**
     * Use the incident's own fingerprint when present, otherwise compute one.
     */
    public static String resolve(Incident incident) {
        String existing = incident.getFingerprint();
        return existing != null && !existing.isBlank() ? existing : fingerprint(incident);
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    static String normalizeTitle(String title) {
        return title == null ? "" : title.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
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

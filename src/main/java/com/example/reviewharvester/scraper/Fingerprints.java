package com.example.reviewharvester.scraper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;

/**
 * Stable review identity from author, date text and normalized body.
 */
public final class Fingerprints {
    private static final char SEPARATOR = '\u001f';

    private Fingerprints() {
    }

    public static String of(String author, String dateText, String body) {
        String key = clean(author) + SEPARATOR + clean(dateText) + SEPARATOR + normalizeBody(body);
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] digest = sha.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 16);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    /** NFC, whitespace runs collapsed to one space, trimmed. */
    public static String normalizeBody(String body) {
        if (body == null) return "";
        return Normalizer.normalize(body, Normalizer.Form.NFC).replaceAll("\\s+", " ").trim();
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim();
    }
}

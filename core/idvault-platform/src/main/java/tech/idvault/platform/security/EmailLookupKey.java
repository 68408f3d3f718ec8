package tech.idvault.platform.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Locale;

/**
 * Derives the deterministic lookup key stored alongside an encrypted email.
 *
 * SHA-256 over the trimmed, lower-cased address, base64 encoded. Every code path
 * that reads or writes {@code emailLookupKey} goes through here.
 */
public final class EmailLookupKey {

    private EmailLookupKey() {
    }

    public static String derive(String email) {
        if (email == null) {
            throw new IllegalArgumentException("Email cannot be null");
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return Base64.getEncoder().encodeToString(md.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

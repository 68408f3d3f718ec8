package tech.idvault.platform.security;

import jakarta.enterprise.context.ApplicationScoped;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption for single sensitive string fields stored at rest.
 *
 * Token format: base64( iv(12) || ciphertext+tag )
 *
 * A fresh IV is drawn for every call, so encrypting the same value twice never
 * produces the same token. The GCM tag makes decryption with the wrong key, or of
 * a modified token, fail instead of returning corrupted text.
 */
@ApplicationScoped
public class FieldCipher {

    public static final int KEY_LENGTH_BYTES = 32;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH_BYTES = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int MIN_TOKEN_BYTES = IV_LENGTH_BYTES + TAG_LENGTH_BITS / 8;

    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Encrypt a value.
     *
     * @param plaintext value to protect, may be empty
     * @param key exactly 32 bytes
     * @return self-contained base64 token
     * @throws FieldCipherException with kind INVALID_KEY if the key is not 256 bits,
     *         INVALID_PLAINTEXT if the value contains an unpaired surrogate
     */
    public String encrypt(String plaintext, byte[] key) {
        SecretKeySpec secretKey = toSecretKey(key);
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext cannot be null");
        }

        byte[] iv = new byte[IV_LENGTH_BYTES];
        RANDOM.nextBytes(iv);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] ct = cipher.doFinal(encodeStrict(plaintext));

            byte[] out = new byte[iv.length + ct.length];
            System.arraycopy(iv, 0, out, 0, iv.length);
            System.arraycopy(ct, 0, out, iv.length, ct.length);

            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new FieldCipherException(FieldCipherException.Kind.CIPHER_FAILURE, "Failed to encrypt field", e);
        }
    }

    /**
     * Decrypt a token produced by {@link #encrypt(String, byte[])}.
     *
     * @param token base64 token
     * @param key the 32-byte key used for encryption
     * @return the exact original plaintext
     * @throws FieldCipherException INVALID_KEY, MALFORMED_CIPHERTEXT or AUTHENTICATION_FAILED
     */
    public String decrypt(String token, byte[] key) {
        SecretKeySpec secretKey = toSecretKey(key);
        if (token == null) {
            throw new FieldCipherException(FieldCipherException.Kind.MALFORMED_CIPHERTEXT, "Ciphertext is missing");
        }

        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(token);
        } catch (IllegalArgumentException e) {
            throw new FieldCipherException(FieldCipherException.Kind.MALFORMED_CIPHERTEXT, "Ciphertext is not valid base64", e);
        }

        if (payload.length < MIN_TOKEN_BYTES) {
            throw new FieldCipherException(FieldCipherException.Kind.MALFORMED_CIPHERTEXT, "Ciphertext too short");
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secretKey,
                new GCMParameterSpec(TAG_LENGTH_BITS, payload, 0, IV_LENGTH_BYTES));
            byte[] pt = cipher.doFinal(payload, IV_LENGTH_BYTES, payload.length - IV_LENGTH_BYTES);
            return new String(pt, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new FieldCipherException(FieldCipherException.Kind.AUTHENTICATION_FAILED,
                "Ciphertext failed authentication (wrong key or corrupted data)", e);
        } catch (GeneralSecurityException e) {
            throw new FieldCipherException(FieldCipherException.Kind.CIPHER_FAILURE, "Failed to decrypt field", e);
        }
    }

    private static byte[] encodeStrict(String plaintext) {
        try {
            ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder().encode(CharBuffer.wrap(plaintext));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw new FieldCipherException(FieldCipherException.Kind.INVALID_PLAINTEXT,
                "Plaintext is not valid UTF-16 text", e);
        }
    }

    private static SecretKeySpec toSecretKey(byte[] key) {
        if (key == null || key.length != KEY_LENGTH_BYTES) {
            throw new FieldCipherException(FieldCipherException.Kind.INVALID_KEY,
                "Encryption key must be " + KEY_LENGTH_BYTES + " bytes");
        }
        return new SecretKeySpec(key, "AES");
    }
}

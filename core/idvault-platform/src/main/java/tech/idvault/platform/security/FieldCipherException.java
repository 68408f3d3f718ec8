package tech.idvault.platform.security;

/**
 * Raised by {@link FieldCipher} when a field cannot be encrypted or decrypted.
 * The message never contains plaintext, ciphertext or key material.
 */
public class FieldCipherException extends RuntimeException {

    public enum Kind {
        /** Key is not exactly 256 bits. */
        INVALID_KEY,
        /** Token is not base64 or is too short to hold an IV and tag. */
        MALFORMED_CIPHERTEXT,
        /** Tag check failed: wrong key or tampered token. */
        AUTHENTICATION_FAILED,
        /** Plaintext contains an unpaired surrogate and has no UTF-8 form. */
        INVALID_PLAINTEXT,
        /** The JCA provider refused the operation. */
        CIPHER_FAILURE
    }

    private final Kind kind;

    public FieldCipherException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FieldCipherException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

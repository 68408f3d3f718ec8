package tech.idvault.platform.authentication;

/**
 * Raised when a session token does not verify. Only two outcomes are reported:
 * the token was valid but has expired, or it is not a valid token at all.
 */
public class SessionTokenException extends RuntimeException {

    public enum Kind {
        EXPIRED,
        INVALID
    }

    private final Kind kind;

    public SessionTokenException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SessionTokenException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

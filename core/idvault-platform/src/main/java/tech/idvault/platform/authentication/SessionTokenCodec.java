package tech.idvault.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;
import tech.idvault.platform.user.Role;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Issues and verifies HS256-signed session tokens (compact JWT).
 *
 * Tokens carry {@code userID}, {@code email}, {@code role}, {@code iat} and {@code exp}.
 * Verification is purely cryptographic and temporal; nothing is looked up.
 */
@ApplicationScoped
public class SessionTokenCodec {

    /** HS256 requires a key of at least 256 bits. */
    public static final int MIN_SECRET_BYTES = 32;

    static final String CLAIM_USER_ID = "userID";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";

    private final Clock clock;

    public SessionTokenCodec() {
        this(Clock.systemUTC());
    }

    public SessionTokenCodec(Clock clock) {
        this.clock = clock;
    }

    /**
     * Issue a signed token.
     *
     * @param userId identity claim
     * @param email decrypted email claim
     * @param role role claim
     * @param ttl validity from now
     * @param secret HMAC secret, at least 32 bytes
     * @return compact serialization
     */
    public String issue(String userId, String email, Role role, Duration ttl, byte[] secret) {
        requireUsableSecret(secret);
        Instant now = clock.instant();

        JwtClaims claims = new JwtClaims();
        claims.setIssuedAt(NumericDate.fromMilliseconds(now.toEpochMilli()));
        claims.setExpirationTime(NumericDate.fromMilliseconds(now.plus(ttl).toEpochMilli()));
        claims.setClaim(CLAIM_USER_ID, userId);
        claims.setClaim(CLAIM_EMAIL, email);
        claims.setClaim(CLAIM_ROLE, role.value());

        JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        jws.setHeader("typ", "JWT");
        jws.setKey(new HmacKey(secret));

        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new IllegalStateException("Failed to sign session token", e);
        }
    }

    /**
     * Verify a token and decode its claims into a typed value.
     *
     * @throws SessionTokenException EXPIRED when the signature is good but {@code exp} has passed,
     *         INVALID for anything else (bad signature, wrong algorithm, garbage, missing claims)
     */
    public SessionClaims verify(String token, byte[] secret) {
        if (token == null || token.isBlank()) {
            throw new SessionTokenException(SessionTokenException.Kind.INVALID, "Token is empty");
        }
        requireUsableSecret(secret);

        JwtConsumer consumer = new JwtConsumerBuilder()
            .setRequireExpirationTime()
            .setAllowedClockSkewInSeconds(0)
            .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
            .setVerificationKey(new HmacKey(secret))
            .setJwsAlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT,
                AlgorithmIdentifiers.HMAC_SHA256)
            .build();

        JwtClaims claims;
        try {
            claims = consumer.processToClaims(token);
        } catch (InvalidJwtException e) {
            if (e.hasExpired()) {
                throw new SessionTokenException(SessionTokenException.Kind.EXPIRED, "Token expired", e);
            }
            throw new SessionTokenException(SessionTokenException.Kind.INVALID, "Token invalid", e);
        }

        return toSessionClaims(claims);
    }

    private SessionClaims toSessionClaims(JwtClaims claims) {
        try {
            String userId = claims.getStringClaimValue(CLAIM_USER_ID);
            String email = claims.getStringClaimValue(CLAIM_EMAIL);
            String roleValue = claims.getStringClaimValue(CLAIM_ROLE);
            if (userId == null || userId.isBlank() || email == null || roleValue == null) {
                throw new SessionTokenException(SessionTokenException.Kind.INVALID, "Token is missing required claims");
            }
            Role role = Role.fromValue(roleValue)
                .orElseThrow(() -> new SessionTokenException(SessionTokenException.Kind.INVALID, "Token carries an unknown role"));

            NumericDate iat = claims.getIssuedAt();
            return new SessionClaims(
                userId,
                email,
                role,
                iat != null ? Instant.ofEpochSecond(iat.getValue()) : null,
                Instant.ofEpochSecond(claims.getExpirationTime().getValue())
            );
        } catch (MalformedClaimException e) {
            throw new SessionTokenException(SessionTokenException.Kind.INVALID, "Token claims are malformed", e);
        }
    }

    private static void requireUsableSecret(byte[] secret) {
        if (secret == null || secret.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("Signing secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
    }
}

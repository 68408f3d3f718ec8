package tech.idvault.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ForbiddenException;
import jakarta.ws.rs.NotAuthorizedException;
import org.jboss.logging.Logger;
import tech.idvault.platform.config.IdvaultConfig;

import java.nio.charset.StandardCharsets;

/**
 * Authenticates a bearer token and optionally enforces the admin role.
 *
 * Authentication always runs before authorization, so a request with a bad token
 * is rejected with 401 and never reaches the role check.
 */
@ApplicationScoped
public class AccessGate {

    private static final Logger LOG = Logger.getLogger(AccessGate.class);

    static final String BEARER_PREFIX = "Bearer ";
    static final String BEARER_CHALLENGE = "Bearer";

    @Inject
    SessionTokenCodec tokenCodec;

    @Inject
    IdvaultConfig config;

    /**
     * Verify the token in an {@code Authorization} header value.
     *
     * @throws NotAuthorizedException header missing, empty, not Bearer, or token expired/invalid
     */
    public AuthenticatedUser authenticate(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw new NotAuthorizedException("Authorization header required", BEARER_CHALLENGE);
        }
        if (!authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new NotAuthorizedException("Invalid token", BEARER_CHALLENGE);
        }

        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        try {
            SessionClaims claims = tokenCodec.verify(token,
                config.auth().signingSecret().getBytes(StandardCharsets.UTF_8));
            return AuthenticatedUser.from(claims);
        } catch (SessionTokenException e) {
            LOG.debugf("Session token rejected: %s", e.getKind());
            String message = e.getKind() == SessionTokenException.Kind.EXPIRED ? "Token expired" : "Invalid token";
            throw new NotAuthorizedException(message, BEARER_CHALLENGE);
        }
    }

    /**
     * Authenticate, then require the admin role when {@code adminOnly} is set.
     *
     * @throws NotAuthorizedException as {@link #authenticate(String)}
     * @throws ForbiddenException valid session without the admin role
     */
    public AuthenticatedUser authorize(String authorizationHeader, boolean adminOnly) {
        AuthenticatedUser user = authenticate(authorizationHeader);
        if (adminOnly && !user.isAdmin()) {
            LOG.debugf("Admin access denied for user %s", user.userId());
            throw new ForbiddenException("Admin access required");
        }
        return user;
    }
}

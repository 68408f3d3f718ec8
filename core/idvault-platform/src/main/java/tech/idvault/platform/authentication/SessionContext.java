package tech.idvault.platform.authentication;

import jakarta.enterprise.context.RequestScoped;
import jakarta.ws.rs.NotAuthorizedException;

/**
 * Request-scoped holder for the principal established by {@link AccessGateFilter}.
 */
@RequestScoped
public class SessionContext {

    private AuthenticatedUser principal;

    void setPrincipal(AuthenticatedUser principal) {
        this.principal = principal;
    }

    /**
     * The verified principal for this request.
     *
     * @throws NotAuthorizedException if called on a route the gate did not run for
     */
    public AuthenticatedUser requirePrincipal() {
        if (principal == null) {
            throw new NotAuthorizedException("Authentication required", AccessGate.BEARER_CHALLENGE);
        }
        return principal;
    }
}

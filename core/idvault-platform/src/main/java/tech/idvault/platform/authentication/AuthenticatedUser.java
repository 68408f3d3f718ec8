package tech.idvault.platform.authentication;

import tech.idvault.platform.user.Role;

/**
 * The principal attached to a request once the access gate has verified its token.
 */
public record AuthenticatedUser(String userId, String email, Role role) {

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    static AuthenticatedUser from(SessionClaims claims) {
        return new AuthenticatedUser(claims.userId(), claims.email(), claims.role());
    }
}

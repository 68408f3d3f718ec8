package tech.idvault.platform.authentication;

import tech.idvault.platform.user.Role;

import java.time.Instant;

/**
 * Decoded payload of a verified session token.
 */
public record SessionClaims(
        String userId,
        String email,
        Role role,
        Instant issuedAt,
        Instant expiresAt
) {}

package tech.idvault.platform.authentication;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.ClientErrorException;
import jakarta.ws.rs.ForbiddenException;
import jakarta.ws.rs.InternalServerErrorException;
import jakarta.ws.rs.NotAuthorizedException;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import tech.idvault.platform.config.IdvaultConfig;
import tech.idvault.platform.security.EmailLookupKey;
import tech.idvault.platform.security.FieldCipher;
import tech.idvault.platform.security.FieldCipherException;
import tech.idvault.platform.shared.TsidGenerator;
import tech.idvault.platform.user.PasswordService;
import tech.idvault.platform.user.Role;
import tech.idvault.platform.user.User;
import tech.idvault.platform.user.UserRepository;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Registration and login for regular users and admins.
 *
 * Each call is stateless. Registration does not issue a token; login returns a
 * 24 hour session token whose claims carry the decrypted email.
 */
@ApplicationScoped
public class AuthenticationService {

    private static final Logger LOG = Logger.getLogger(AuthenticationService.class);

    public static final Duration SESSION_TTL = Duration.ofHours(24);

    static final String INVALID_CREDENTIALS = "Invalid credentials";
    static final String PASSWORD_TOO_LONG =
        "Password must not exceed " + PasswordService.MAX_PASSWORD_BYTES + " bytes";

    @Inject
    UserRepository userRepo;

    @Inject
    PasswordService passwordService;

    @Inject
    FieldCipher fieldCipher;

    @Inject
    SessionTokenCodec tokenCodec;

    @Inject
    IdvaultConfig config;

    Clock clock = Clock.systemUTC();

    /**
     * Register a regular user.
     *
     * A requested role of "admin" is ignored: admins can only be created through
     * {@link #registerAdmin}. Any value other than "user" or "admin" is rejected.
     *
     * @throws BadRequestException missing email/password or unknown role value
     * @throws ClientErrorException 409 if the email is already registered
     */
    public User register(String email, String password, String requestedRole) {
        validateCredentials(email, password);

        if (requestedRole != null && !requestedRole.isEmpty()) {
            Role requested = Role.fromValue(requestedRole)
                .orElseThrow(() -> new BadRequestException("Invalid role. Must be 'user' or 'admin'"));
            if (requested == Role.ADMIN) {
                LOG.warn("Ignoring self-requested admin role on public registration");
            }
        }

        User user = createUser(email, password, Role.USER, "User already exists");
        LOG.infof("User registered: %s", user.id);
        return user;
    }

    /**
     * Register an admin.
     *
     * The caller must be an authenticated admin, except when no admin exists yet:
     * the very first admin may be created without a session.
     *
     * @param actor the verified caller, empty when the request carried no token
     * @throws NotAuthorizedException no session and at least one admin already exists
     * @throws ForbiddenException session without the admin role
     * @throws ClientErrorException 409 if the email is already registered
     */
    public User registerAdmin(String email, String password, Optional<AuthenticatedUser> actor) {
        validateCredentials(email, password);

        if (actor.isPresent()) {
            if (!actor.get().isAdmin()) {
                throw new ForbiddenException("Admin access required");
            }
        } else if (userRepo.countByRole(Role.ADMIN) > 0) {
            throw new NotAuthorizedException("Authorization header required", AccessGate.BEARER_CHALLENGE);
        }

        User user = createUser(email, password, Role.ADMIN, "Admin already exists");
        LOG.infof("Admin registered: %s by %s", user.id,
            actor.map(AuthenticatedUser::userId).orElse("bootstrap"));
        return user;
    }

    /**
     * Log in with email and password.
     *
     * Unknown email and wrong password produce the same 401 so callers cannot
     * probe which addresses are registered.
     */
    public LoginResult login(String email, String password) {
        validateCredentials(email, password);
        User user = verifyCredentials(email, password);
        return issueSession(user);
    }

    /**
     * Log in through the admin entry point. Credentials are checked first; a
     * correct login for a non-admin account is then refused with 403.
     */
    public LoginResult loginAdmin(String email, String password) {
        validateCredentials(email, password);
        User user = verifyCredentials(email, password);

        if (!user.isAdmin()) {
            LOG.infof("Admin login refused for non-admin user %s", user.id);
            throw new ForbiddenException("Access denied: Admin only");
        }
        return issueSession(user);
    }

    private User createUser(String email, String password, Role role, String conflictMessage) {
        String lookupKey = EmailLookupKey.derive(email);
        if (userRepo.findByEmailLookupKey(lookupKey).isPresent()) {
            throw new ClientErrorException(conflictMessage, Response.Status.CONFLICT);
        }

        String passwordHash = passwordService.hashPassword(password);
        String encryptedEmail = encryptEmail(email.trim());

        Instant now = clock.instant();
        User user = new User();
        user.id = TsidGenerator.generate();
        user.emailLookupKey = lookupKey;
        user.encryptedEmail = encryptedEmail;
        user.passwordHash = passwordHash;
        user.role = role;
        user.createdAt = now;
        user.updatedAt = now;

        userRepo.persist(user);
        return user;
    }

    private User verifyCredentials(String email, String password) {
        Optional<User> userOpt = userRepo.findByEmailLookupKey(EmailLookupKey.derive(email));
        if (userOpt.isEmpty()) {
            LOG.debug("Login failed: no account for lookup key");
            throw new NotAuthorizedException(INVALID_CREDENTIALS, AccessGate.BEARER_CHALLENGE);
        }

        User user = userOpt.get();
        if (!passwordService.verifyPassword(password, user.passwordHash)) {
            LOG.infof("Login failed: invalid password for user %s", user.id);
            throw new NotAuthorizedException(INVALID_CREDENTIALS, AccessGate.BEARER_CHALLENGE);
        }
        return user;
    }

    private LoginResult issueSession(User user) {
        String email;
        try {
            email = fieldCipher.decrypt(user.encryptedEmail, encryptionKey());
        } catch (FieldCipherException e) {
            LOG.errorf("Failed to decrypt email for user %s: %s", user.id, e.getKind());
            throw new InternalServerErrorException("Failed to decrypt data");
        }

        String token = tokenCodec.issue(user.id, email, user.role, SESSION_TTL,
            config.auth().signingSecret().getBytes(StandardCharsets.UTF_8));

        LOG.infof("Login successful for user: %s", user.id);
        return new LoginResult(token, user.role);
    }

    private String encryptEmail(String email) {
        try {
            return fieldCipher.encrypt(email, encryptionKey());
        } catch (FieldCipherException e) {
            if (e.getKind() == FieldCipherException.Kind.INVALID_PLAINTEXT) {
                throw new BadRequestException("Invalid email format");
            }
            LOG.errorf("Failed to encrypt email: %s", e.getKind());
            throw new InternalServerErrorException("Failed to encrypt data");
        }
    }

    private byte[] encryptionKey() {
        return config.encryption().key().getBytes(StandardCharsets.UTF_8);
    }

    private static void validateCredentials(String email, String password) {
        if (email == null || email.isBlank() || password == null || password.isEmpty()) {
            throw new BadRequestException("Email and password are required");
        }
        if (email.indexOf('@') < 1) {
            throw new BadRequestException("Invalid email format");
        }
        if (PasswordService.exceedsMaxLength(password)) {
            throw new BadRequestException(PASSWORD_TOO_LONG);
        }
    }

    /**
     * Outcome of a successful login.
     */
    public record LoginResult(String token, Role role) {}
}

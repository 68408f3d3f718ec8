package tech.idvault.platform.user;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.ClientErrorException;
import jakarta.ws.rs.InternalServerErrorException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import tech.idvault.platform.authentication.AuthenticatedUser;
import tech.idvault.platform.config.IdvaultConfig;
import tech.idvault.platform.security.EmailLookupKey;
import tech.idvault.platform.security.FieldCipher;
import tech.idvault.platform.security.FieldCipherException;
import tech.idvault.platform.shared.TsidGenerator;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Profile self-service and admin user management.
 *
 * Callers have already passed the access gate; the verified principal is passed in
 * explicitly where the operation acts on the caller's own record.
 */
@ApplicationScoped
public class UserService {

    private static final Logger LOG = Logger.getLogger(UserService.class);

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    @Inject
    UserRepository userRepo;

    @Inject
    PasswordService passwordService;

    @Inject
    FieldCipher fieldCipher;

    @Inject
    IdvaultConfig config;

    Clock clock = Clock.systemUTC();

    /**
     * Load the caller's own profile with the email decrypted.
     *
     * @throws NotFoundException if the account behind the token no longer exists
     */
    public UserView getProfile(AuthenticatedUser principal) {
        User user = userRepo.findByIdOptional(principal.userId())
            .orElseThrow(() -> new NotFoundException("User not found"));
        return toView(user);
    }

    /**
     * Update the caller's email and/or password.
     *
     * @param newEmail replacement email, null or blank to keep the current one
     * @param newPassword replacement password, null or empty to keep the current one
     * @throws BadRequestException neither field supplied, malformed email or password over 72 bytes
     * @throws ClientErrorException 409 if another user already has the new email
     * @throws NotFoundException if the account no longer exists
     */
    public void updateProfile(AuthenticatedUser principal, String newEmail, String newPassword) {
        boolean changeEmail = newEmail != null && !newEmail.isBlank();
        boolean changePassword = newPassword != null && !newPassword.isEmpty();
        if (!changeEmail && !changePassword) {
            throw new BadRequestException("Nothing to update");
        }
        if (changeEmail && newEmail.indexOf('@') < 1) {
            throw new BadRequestException("Invalid email format");
        }
        if (changePassword && PasswordService.exceedsMaxLength(newPassword)) {
            throw new BadRequestException("Password must not exceed " + PasswordService.MAX_PASSWORD_BYTES + " bytes");
        }

        User user = userRepo.findByIdOptional(principal.userId())
            .orElseThrow(() -> new NotFoundException("User not found"));

        if (changeEmail) {
            String lookupKey = EmailLookupKey.derive(newEmail);
            if (userRepo.existsByEmailLookupKeyExcluding(lookupKey, user.id)) {
                throw new ClientErrorException("Email already in use", Response.Status.CONFLICT);
            }
            user.encryptedEmail = encrypt(newEmail.trim());
            user.emailLookupKey = lookupKey;
        }

        if (changePassword) {
            user.passwordHash = passwordService.hashPassword(newPassword);
        }

        user.updatedAt = clock.instant();
        userRepo.update(user);
        LOG.infof("Profile updated for user %s (email=%s, password=%s)", user.id, changeEmail, changePassword);
    }

    /**
     * List users newest first.
     * Out-of-range paging values fall back to the defaults (page 1, limit 10, limit at most 100).
     */
    public UserPage listUsers(Integer page, Integer limit) {
        int effectivePage = page != null && page > 0 ? page : DEFAULT_PAGE;
        int effectiveLimit = limit != null && limit > 0 && limit <= MAX_LIMIT ? limit : DEFAULT_LIMIT;

        long total = userRepo.count();
        long skip = (long) (effectivePage - 1) * effectiveLimit;
        // Past the last addressable page: nothing can be there.
        List<UserView> users = skip > Integer.MAX_VALUE - effectiveLimit
            ? List.of()
            : userRepo.findPageNewestFirst(effectivePage - 1, effectiveLimit).stream()
                .map(this::toView)
                .toList();

        int totalPages = (int) ((total + effectiveLimit - 1) / effectiveLimit);
        return new UserPage(users, total, effectivePage, effectiveLimit, totalPages);
    }

    /**
     * Delete a user.
     *
     * @throws BadRequestException malformed id
     * @throws NotFoundException no such user
     */
    public void deleteUser(String userId, AuthenticatedUser actor) {
        requireValidId(userId);
        if (!userRepo.deleteById(userId)) {
            throw new NotFoundException("User not found");
        }
        LOG.infof("User %s deleted by admin %s", userId, actor.userId());
    }

    /**
     * Change a user's role.
     *
     * @throws BadRequestException malformed id or role other than "user"/"admin"
     * @throws NotFoundException no such user
     */
    public void updateUserRole(String userId, String roleValue, AuthenticatedUser actor) {
        requireValidId(userId);
        Role role = Role.fromValue(roleValue)
            .orElseThrow(() -> new BadRequestException("Invalid role. Must be 'user' or 'admin'"));

        User user = userRepo.findByIdOptional(userId)
            .orElseThrow(() -> new NotFoundException("User not found"));

        user.role = role;
        user.updatedAt = clock.instant();
        userRepo.update(user);
        LOG.infof("Role of user %s set to %s by admin %s", userId, role.value(), actor.userId());
    }

    private UserView toView(User user) {
        String email;
        try {
            email = fieldCipher.decrypt(user.encryptedEmail, encryptionKey());
        } catch (FieldCipherException e) {
            LOG.errorf("Failed to decrypt email for user %s: %s", user.id, e.getKind());
            throw new InternalServerErrorException("Failed to decrypt user data");
        }
        return new UserView(user.id, email, user.role, user.createdAt, user.updatedAt);
    }

    private String encrypt(String email) {
        try {
            return fieldCipher.encrypt(email, encryptionKey());
        } catch (FieldCipherException e) {
            if (e.getKind() == FieldCipherException.Kind.INVALID_PLAINTEXT) {
                throw new BadRequestException("Invalid email format");
            }
            LOG.errorf("Failed to encrypt email: %s", e.getKind());
            throw new InternalServerErrorException("Failed to encrypt email");
        }
    }

    private byte[] encryptionKey() {
        return config.encryption().key().getBytes(StandardCharsets.UTF_8);
    }

    private static void requireValidId(String userId) {
        if (!TsidGenerator.isValid(userId)) {
            throw new BadRequestException("Invalid user ID format");
        }
    }

    /**
     * A user as returned to callers: decrypted email, no password hash.
     */
    public record UserView(
            String id,
            String email,
            Role role,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt
    ) {}

    public record UserPage(
            List<UserView> users,
            long total,
            int page,
            int limit,
            @JsonProperty("total_pages") int totalPages
    ) {}
}

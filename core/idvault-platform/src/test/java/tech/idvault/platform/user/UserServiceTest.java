package tech.idvault.platform.user;

import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.ClientErrorException;
import jakarta.ws.rs.InternalServerErrorException;
import jakarta.ws.rs.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.idvault.platform.authentication.AuthenticatedUser;
import tech.idvault.platform.config.StaticIdvaultConfig;
import tech.idvault.platform.security.EmailLookupKey;
import tech.idvault.platform.security.FieldCipher;
import tech.idvault.platform.shared.TsidGenerator;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for UserService.
 */
@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    private static final Instant CREATED = Instant.parse("2026-01-01T00:00:00Z");
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final byte[] KEY = StaticIdvaultConfig.ENCRYPTION_KEY.getBytes(StandardCharsets.UTF_8);

    @Mock
    UserRepository userRepo;

    @Mock
    PasswordService passwordService;

    @InjectMocks
    UserService userService;

    private final FieldCipher fieldCipher = new FieldCipher();

    private User alice;
    private AuthenticatedUser alicePrincipal;
    private final AuthenticatedUser admin = new AuthenticatedUser("0ADMIN0000001", "root@x.com", Role.ADMIN);

    @BeforeEach
    void setUp() {
        userService.fieldCipher = fieldCipher;
        userService.config = new StaticIdvaultConfig();
        userService.clock = Clock.fixed(NOW, ZoneOffset.UTC);

        alice = new User();
        alice.id = TsidGenerator.generate();
        alice.emailLookupKey = EmailLookupKey.derive("alice@x.com");
        alice.encryptedEmail = fieldCipher.encrypt("alice@x.com", KEY);
        alice.passwordHash = "$2a$10$original";
        alice.role = Role.USER;
        alice.createdAt = CREATED;
        alice.updatedAt = CREATED;

        alicePrincipal = new AuthenticatedUser(alice.id, "alice@x.com", Role.USER);
    }

    // ========================================================================
    // getProfile
    // ========================================================================

    @Test
    @DisplayName("getProfile should return the decrypted email and no hash")
    void getProfile_shouldReturnView() {
        when(userRepo.findByIdOptional(alice.id)).thenReturn(Optional.of(alice));

        UserService.UserView view = userService.getProfile(alicePrincipal);

        assertThat(view.id()).isEqualTo(alice.id);
        assertThat(view.email()).isEqualTo("alice@x.com");
        assertThat(view.role()).isEqualTo(Role.USER);
        assertThat(view.createdAt()).isEqualTo(CREATED);
    }

    @Test
    @DisplayName("getProfile should be 404 when the account is gone")
    void getProfile_shouldReturn404WhenMissing() {
        when(userRepo.findByIdOptional(alice.id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.getProfile(alicePrincipal))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("getProfile should be 500 when the stored email cannot be decrypted")
    void getProfile_shouldFailOnCorruptEmail() {
        alice.encryptedEmail = "corrupted";
        when(userRepo.findByIdOptional(alice.id)).thenReturn(Optional.of(alice));

        assertThatThrownBy(() -> userService.getProfile(alicePrincipal))
            .isInstanceOf(InternalServerErrorException.class)
            .hasMessage("Failed to decrypt user data");
    }

    // ========================================================================
    // updateProfile
    // ========================================================================

    @Test
    @DisplayName("updateProfile should require at least one field")
    void updateProfile_shouldRejectEmptyUpdate() {
        assertThatThrownBy(() -> userService.updateProfile(alicePrincipal, null, ""))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Nothing to update");

        verifyNoInteractions(userRepo);
    }

    @Test
    @DisplayName("updateProfile should re-encrypt a new email and move the lookup key")
    void updateProfile_shouldChangeEmail() {
        when(userRepo.findByIdOptional(alice.id)).thenReturn(Optional.of(alice));
        when(userRepo.existsByEmailLookupKeyExcluding(EmailLookupKey.derive("new@x.com"), alice.id)).thenReturn(false);

        userService.updateProfile(alicePrincipal, "new@x.com", null);

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepo).update(captor.capture());
        User updated = captor.getValue();
        assertThat(fieldCipher.decrypt(updated.encryptedEmail, KEY)).isEqualTo("new@x.com");
        assertThat(updated.emailLookupKey).isEqualTo(EmailLookupKey.derive("new@x.com"));
        assertThat(updated.passwordHash).isEqualTo("$2a$10$original");
        assertThat(updated.updatedAt).isEqualTo(NOW);
        assertThat(updated.createdAt).isEqualTo(CREATED);
        verifyNoInteractions(passwordService);
    }

    @Test
    @DisplayName("updateProfile should re-hash a new password")
    void updateProfile_shouldChangePassword() {
        when(userRepo.findByIdOptional(alice.id)).thenReturn(Optional.of(alice));
        when(passwordService.hashPassword("new-password")).thenReturn("$2a$10$new");

        userService.updateProfile(alicePrincipal, null, "new-password");

        verify(userRepo).update(alice);
        assertThat(alice.passwordHash).isEqualTo("$2a$10$new");
        assertThat(alice.emailLookupKey).isEqualTo(EmailLookupKey.derive("alice@x.com"));
        verify(userRepo, never()).existsByEmailLookupKeyExcluding(anyString(), anyString());
    }

    @Test
    @DisplayName("updateProfile should refuse an email held by another user")
    void updateProfile_shouldRejectTakenEmail() {
        when(userRepo.findByIdOptional(alice.id)).thenReturn(Optional.of(alice));
        when(userRepo.existsByEmailLookupKeyExcluding(EmailLookupKey.derive("bob@x.com"), alice.id)).thenReturn(true);

        assertThatThrownBy(() -> userService.updateProfile(alicePrincipal, "bob@x.com", null))
            .isInstanceOf(ClientErrorException.class)
            .hasMessage("Email already in use")
            .satisfies(e -> assertThat(((ClientErrorException) e).getResponse().getStatus()).isEqualTo(409));

        verify(userRepo, never()).update(any());
    }

    @Test
    @DisplayName("updateProfile should reject a malformed email")
    void updateProfile_shouldRejectMalformedEmail() {
        assertThatThrownBy(() -> userService.updateProfile(alicePrincipal, "not-an-email", null))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Invalid email format");
    }

    @Test
    @DisplayName("updateProfile should reject a password longer than 72 bytes with 400")
    void updateProfile_shouldRejectOverlongPassword() {
        assertThatThrownBy(() -> userService.updateProfile(alicePrincipal, null, "a".repeat(72) + "X"))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Password must not exceed 72 bytes");

        verifyNoInteractions(userRepo, passwordService);
    }

    // ========================================================================
    // listUsers
    // ========================================================================

    @Test
    @DisplayName("listUsers should apply defaults and compute total pages")
    void listUsers_shouldUseDefaults() {
        when(userRepo.count()).thenReturn(25L);
        when(userRepo.findPageNewestFirst(0, 10)).thenReturn(List.of(alice));

        UserService.UserPage page = userService.listUsers(null, null);

        assertThat(page.page()).isEqualTo(1);
        assertThat(page.limit()).isEqualTo(10);
        assertThat(page.total()).isEqualTo(25);
        assertThat(page.totalPages()).isEqualTo(3);
        assertThat(page.users()).extracting(UserService.UserView::email).containsExactly("alice@x.com");
    }

    @Test
    @DisplayName("listUsers should fall back to defaults for out-of-range values")
    void listUsers_shouldClampOutOfRangeValues() {
        when(userRepo.count()).thenReturn(0L);
        when(userRepo.findPageNewestFirst(0, 10)).thenReturn(List.of());

        UserService.UserPage page = userService.listUsers(0, 101);

        assertThat(page.page()).isEqualTo(1);
        assertThat(page.limit()).isEqualTo(10);
        assertThat(page.totalPages()).isZero();
        assertThat(page.users()).isEmpty();
    }

    @Test
    @DisplayName("listUsers should translate page numbers to zero-based indexes")
    void listUsers_shouldRequestRequestedPage() {
        when(userRepo.count()).thenReturn(250L);
        when(userRepo.findPageNewestFirst(2, 100)).thenReturn(List.of());

        UserService.UserPage page = userService.listUsers(3, 100);

        assertThat(page.totalPages()).isEqualTo(3);
        verify(userRepo).findPageNewestFirst(2, 100);
    }

    @Test
    @DisplayName("listUsers should return an empty page instead of querying past the addressable range")
    void listUsers_shouldNotOverflowSkipForHugePage() {
        when(userRepo.count()).thenReturn(5L);

        UserService.UserPage page = userService.listUsers(Integer.MAX_VALUE, 100);

        assertThat(page.users()).isEmpty();
        assertThat(page.page()).isEqualTo(Integer.MAX_VALUE);
        assertThat(page.total()).isEqualTo(5);
        verify(userRepo, never()).findPageNewestFirst(anyInt(), anyInt());
    }

    // ========================================================================
    // deleteUser / updateUserRole
    // ========================================================================

    @Test
    @DisplayName("deleteUser should reject malformed ids before touching the store")
    void deleteUser_shouldRejectBadId() {
        assertThatThrownBy(() -> userService.deleteUser("not-an-id", admin))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Invalid user ID format");

        verifyNoInteractions(userRepo);
    }

    @Test
    @DisplayName("deleteUser should be 404 for an unknown id")
    void deleteUser_shouldReturn404WhenMissing() {
        String id = TsidGenerator.generate();
        when(userRepo.deleteById(id)).thenReturn(false);

        assertThatThrownBy(() -> userService.deleteUser(id, admin))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("User not found");
    }

    @Test
    @DisplayName("deleteUser should delete an existing user")
    void deleteUser_shouldDelete() {
        when(userRepo.deleteById(alice.id)).thenReturn(true);

        assertThatCode(() -> userService.deleteUser(alice.id, admin)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("updateUserRole should promote and bump updatedAt")
    void updateUserRole_shouldPromote() {
        when(userRepo.findByIdOptional(alice.id)).thenReturn(Optional.of(alice));

        userService.updateUserRole(alice.id, "admin", admin);

        verify(userRepo).update(alice);
        assertThat(alice.role).isEqualTo(Role.ADMIN);
        assertThat(alice.updatedAt).isEqualTo(NOW);
    }

    @Test
    @DisplayName("updateUserRole should reject values other than user and admin")
    void updateUserRole_shouldRejectUnknownRole() {
        assertThatThrownBy(() -> userService.updateUserRole(alice.id, "ADMIN", admin))
            .isInstanceOf(BadRequestException.class)
            .hasMessage("Invalid role. Must be 'user' or 'admin'");

        verifyNoInteractions(userRepo);
    }

    @Test
    @DisplayName("updateUserRole should be 404 for an unknown id")
    void updateUserRole_shouldReturn404WhenMissing() {
        String id = TsidGenerator.generate();
        when(userRepo.findByIdOptional(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.updateUserRole(id, "user", admin))
            .isInstanceOf(NotFoundException.class);
    }
}

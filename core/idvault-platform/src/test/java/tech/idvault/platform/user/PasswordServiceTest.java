package tech.idvault.platform.user;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * SECURITY TESTS: password hashing
 *
 * THREAT MODEL:
 * 1. Rainbow table attacks via unsalted passwords
 * 2. Stored hashes revealing the password
 * 3. Verification blowing up on bad input instead of refusing
 */
class PasswordServiceTest {

    private final PasswordService passwordService = new PasswordService();

    @Test
    @DisplayName("SECURITY: hash verifies against the original password")
    void verifyPassword_shouldAcceptOriginalPassword() {
        String hash = passwordService.hashPassword("pw123456");

        assertThat(passwordService.verifyPassword("pw123456", hash)).isTrue();
    }

    @Test
    @DisplayName("SECURITY: hash rejects any other password")
    void verifyPassword_shouldRejectDifferentPassword() {
        String hash = passwordService.hashPassword("pw123456");

        assertThat(passwordService.verifyPassword("pw1234567", hash)).isFalse();
        assertThat(passwordService.verifyPassword("PW123456", hash)).isFalse();
        assertThat(passwordService.verifyPassword("", hash)).isFalse();
    }

    @Test
    @DisplayName("SECURITY: same password produces different hashes (salt protection)")
    void hashPassword_shouldSaltEveryHash() {
        String first = passwordService.hashPassword("SamePass123!");
        String second = passwordService.hashPassword("SamePass123!");

        assertThat(first).isNotEqualTo(second);
        assertThat(passwordService.verifyPassword("SamePass123!", first)).isTrue();
        assertThat(passwordService.verifyPassword("SamePass123!", second)).isTrue();
    }

    @Test
    @DisplayName("SECURITY: hash is BCrypt MCF and never contains the password")
    void hashPassword_shouldProduceBcryptModularCrypt() {
        String hash = passwordService.hashPassword("pw123456");

        assertThat(hash).startsWith("$2").doesNotContain("pw123456");
    }

    @Test
    @DisplayName("verifyPassword returns false instead of throwing on bad input")
    void verifyPassword_shouldReturnFalseForUnusableInput() {
        assertThat(passwordService.verifyPassword(null, "$2a$10$abc")).isFalse();
        assertThat(passwordService.verifyPassword("pw123456", null)).isFalse();
        assertThat(passwordService.verifyPassword("pw123456", "not-a-hash")).isFalse();
    }

    @Test
    @DisplayName("empty passwords cannot be hashed")
    void hashPassword_shouldRejectEmptyPassword() {
        assertThatThrownBy(() -> passwordService.hashPassword(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Password cannot be null or empty");
        assertThatThrownBy(() -> passwordService.hashPassword(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("SECURITY: passwords BCrypt would truncate are refused instead of silently shortened")
    void hashPassword_shouldRejectPasswordsLongerThan72Bytes() {
        String tooLong = "a".repeat(72) + "X";

        assertThatThrownBy(() -> passwordService.hashPassword(tooLong))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("72 bytes");
    }

    @Test
    @DisplayName("SECURITY: length limit counts UTF-8 bytes, not characters")
    void hashPassword_shouldMeasureLimitInUtf8Bytes() {
        // 37 two-byte characters = 74 bytes
        String multiByte = "é".repeat(37);

        assertThat(PasswordService.exceedsMaxLength(multiByte)).isTrue();
        assertThatThrownBy(() -> passwordService.hashPassword(multiByte))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("SECURITY: a 72-byte password hashes and only verifies against itself")
    void verifyPassword_shouldDistinguishPasswordsAtTheLimit() {
        String atLimit = "a".repeat(71) + "X";
        String hash = passwordService.hashPassword(atLimit);

        assertThat(passwordService.verifyPassword(atLimit, hash)).isTrue();
        assertThat(passwordService.verifyPassword("a".repeat(71) + "Y", hash)).isFalse();
    }
}

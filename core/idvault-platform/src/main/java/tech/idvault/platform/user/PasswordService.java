package tech.idvault.platform.user;

import jakarta.enterprise.context.ApplicationScoped;
import org.wildfly.security.password.Password;
import org.wildfly.security.password.PasswordFactory;
import org.wildfly.security.password.WildFlyElytronPasswordProvider;
import org.wildfly.security.password.interfaces.BCryptPassword;
import org.wildfly.security.password.spec.EncryptablePasswordSpec;
import org.wildfly.security.password.spec.IteratedSaltedPasswordAlgorithmSpec;
import org.wildfly.security.password.util.ModularCrypt;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.Security;
import java.security.spec.InvalidKeySpecException;

/**
 * Service for password hashing and validation using BCrypt via WildFly Elytron.
 * Every hash carries its own random salt, so hashing the same password twice
 * yields two different strings that both verify.
 */
@ApplicationScoped
public class PasswordService {

    private static final String BCRYPT_ALGORITHM = BCryptPassword.ALGORITHM_BCRYPT;
    private static final int BCRYPT_COST = 10; // BCrypt cost parameter (iterations = 2^10)
    private static final int SALT_SIZE = 16; // 16 bytes = 128 bits

    /** BCrypt ignores everything past the first 72 bytes of input. */
    public static final int MAX_PASSWORD_BYTES = 72;

    private static final SecureRandom RANDOM = new SecureRandom();

    static {
        // Register WildFly Elytron password provider with Java Security
        Security.addProvider(WildFlyElytronPasswordProvider.getInstance());
    }

    /**
     * Hash a password using BCrypt.
     *
     * @param plainPassword The plain text password
     * @return The hashed password in Modular Crypt Format
     * @throws IllegalArgumentException if the password is null, empty or longer than 72 UTF-8 bytes
     */
    public String hashPassword(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        if (exceedsMaxLength(plainPassword)) {
            throw new IllegalArgumentException("Password must not exceed " + MAX_PASSWORD_BYTES + " bytes");
        }

        try {
            PasswordFactory factory = PasswordFactory.getInstance(BCRYPT_ALGORITHM);

            byte[] salt = new byte[SALT_SIZE];
            RANDOM.nextBytes(salt);

            IteratedSaltedPasswordAlgorithmSpec spec =
                new IteratedSaltedPasswordAlgorithmSpec(BCRYPT_COST, salt);

            EncryptablePasswordSpec encryptSpec =
                new EncryptablePasswordSpec(plainPassword.toCharArray(), spec);

            Password password = factory.generatePassword(encryptSpec);

            return ModularCrypt.encodeAsString(password);

        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new IllegalStateException("Failed to hash password", e);
        }
    }

    /**
     * Whether a password is too long for BCrypt to hash without truncating it.
     */
    public static boolean exceedsMaxLength(String plainPassword) {
        return plainPassword.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }

    /**
     * Verify a password against a hash.
     * Never throws: a mismatch, a null input or an unreadable hash all yield false.
     *
     * @param plainPassword The plain text password to verify
     * @param passwordHash The hash to verify against
     * @return true if password matches the hash
     */
    public boolean verifyPassword(String plainPassword, String passwordHash) {
        if (plainPassword == null || passwordHash == null) {
            return false;
        }

        try {
            PasswordFactory factory = PasswordFactory.getInstance(BCRYPT_ALGORITHM);

            Password userPassword = ModularCrypt.decode(passwordHash);
            Password inputPassword = factory.translate(userPassword);

            return factory.verify(inputPassword, plainPassword.toCharArray());

        } catch (NoSuchAlgorithmException | InvalidKeyException | InvalidKeySpecException e) {
            // Invalid hash format or algorithm error
            return false;
        }
    }
}

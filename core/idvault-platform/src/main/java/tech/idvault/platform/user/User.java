package tech.idvault.platform.user;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;

/**
 * A registered user account.
 *
 * The email address is never stored in plaintext: {@link #encryptedEmail} holds the
 * field-cipher token and {@link #emailLookupKey} the deterministic key used for
 * uniqueness checks and login lookups.
 */
@MongoEntity(collection = "users")
public class User extends PanacheMongoEntityBase {

    @BsonId
    public String id;

    public String emailLookupKey;

    public String encryptedEmail;

    /**
     * BCrypt hash in Modular Crypt Format. Never returned or logged.
     */
    public String passwordHash;

    public Role role = Role.USER;

    public Instant createdAt;

    public Instant updatedAt;

    public User() {
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}

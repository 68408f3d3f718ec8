package tech.idvault.platform.config;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.bson.Document;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import tech.idvault.platform.authentication.SessionTokenCodec;
import tech.idvault.platform.security.FieldCipher;

import java.nio.charset.StandardCharsets;

/**
 * Startup checks for the platform.
 *
 * Verifies the key material, confirms MongoDB is reachable and creates the user
 * indexes. Any failure here aborts startup; there is no degraded mode.
 */
@ApplicationScoped
public class PlatformStartup {

    private static final Logger LOG = Logger.getLogger(PlatformStartup.class);

    static final String USERS_COLLECTION = "users";

    /** Values shipped in application.properties for local development only. */
    static final String DEV_SIGNING_SECRET = "your-secret-key-change-me-before-deploying";
    static final String DEV_ENCRYPTION_KEY = "your-32-byte-encryption-key-here";

    @Inject
    MongoClient mongoClient;

    @Inject
    IdvaultConfig config;

    @ConfigProperty(name = "quarkus.mongodb.database")
    String databaseName;

    void onStart(@Observes StartupEvent ev) {
        validateKeyMaterial(config);

        MongoDatabase db = mongoClient.getDatabase(databaseName);
        try {
            db.runCommand(new Document("ping", 1));
        } catch (MongoException e) {
            LOG.error("Failed to connect to MongoDB", e);
            throw new IllegalStateException("MongoDB is not reachable", e);
        }
        LOG.infof("MongoDB connected successfully (database=%s)", databaseName);

        createUserIndexes(db);
    }

    /**
     * Reject key material the crypto primitives cannot use and warn about development defaults.
     *
     * @throws IllegalStateException if a key has the wrong length
     */
    static void validateKeyMaterial(IdvaultConfig config) {
        String secret = config.auth().signingSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < SessionTokenCodec.MIN_SECRET_BYTES) {
            throw new IllegalStateException("idvault.auth.signing-secret must be at least "
                + SessionTokenCodec.MIN_SECRET_BYTES + " bytes");
        }

        String key = config.encryption().key();
        if (key == null || key.getBytes(StandardCharsets.UTF_8).length != FieldCipher.KEY_LENGTH_BYTES) {
            throw new IllegalStateException("idvault.encryption.key must be exactly "
                + FieldCipher.KEY_LENGTH_BYTES + " bytes");
        }

        if (DEV_SIGNING_SECRET.equals(secret)) {
            LOG.warn("Using the built-in development signing secret. Set JWT_SECRET in production.");
        }
        if (DEV_ENCRYPTION_KEY.equals(key)) {
            LOG.warn("Using the built-in development encryption key. Set ENCRYPTION_KEY in production.");
        }
    }

    private void createUserIndexes(MongoDatabase db) {
        MongoCollection<Document> users = db.getCollection(USERS_COLLECTION);
        // Not unique: registration enforces uniqueness with a check-then-insert.
        users.createIndex(Indexes.ascending("emailLookupKey"), opt());
        users.createIndex(Indexes.ascending("role"), opt());
        users.createIndex(Indexes.descending("createdAt"), opt());
        LOG.info("MongoDB indexes initialized successfully");
    }

    private IndexOptions opt() {
        return new IndexOptions().background(true);
    }
}

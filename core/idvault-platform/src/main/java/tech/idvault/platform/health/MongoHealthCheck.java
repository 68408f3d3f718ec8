package tech.idvault.platform.health;

import com.mongodb.client.MongoClient;
import io.quarkus.arc.Unremovable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.Document;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check for the user store.
 * Reports down while MongoDB does not answer a ping.
 */
@Unremovable
@Readiness
@ApplicationScoped
public class MongoHealthCheck implements HealthCheck {

    static final String NAME = "MongoDB";

    @Inject
    MongoClient mongoClient;

    @ConfigProperty(name = "quarkus.mongodb.database")
    String databaseName;

    @Override
    public HealthCheckResponse call() {
        try {
            mongoClient.getDatabase(databaseName).runCommand(new Document("ping", 1));

            return HealthCheckResponse.builder()
                    .name(NAME)
                    .up()
                    .withData("database", databaseName)
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.builder()
                    .name(NAME)
                    .down()
                    .withData("error", e.getMessage())
                    .build();
        }
    }
}

package tech.idvault.platform.health;

import com.mongodb.MongoTimeoutException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoHealthCheckTest {

    @Mock
    MongoClient mongoClient;

    @Mock
    MongoDatabase database;

    @InjectMocks
    MongoHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        healthCheck.databaseName = "idvault";
        when(mongoClient.getDatabase("idvault")).thenReturn(database);
    }

    @Test
    @DisplayName("reports up when MongoDB answers the ping")
    void call_shouldBeUpWhenPingSucceeds() {
        when(database.runCommand(any(Bson.class))).thenReturn(new Document("ok", 1.0));

        HealthCheckResponse response = healthCheck.call();

        assertThat(response.getName()).isEqualTo("MongoDB");
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data ->
            assertThat(data).containsEntry("database", "idvault"));
    }

    @Test
    @DisplayName("reports down when the ping fails")
    void call_shouldBeDownWhenPingFails() {
        when(database.runCommand(any(Bson.class))).thenThrow(new MongoTimeoutException("Timed out waiting for a server"));

        HealthCheckResponse response = healthCheck.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(data ->
            assertThat(data).containsEntry("error", "Timed out waiting for a server"));
    }
}

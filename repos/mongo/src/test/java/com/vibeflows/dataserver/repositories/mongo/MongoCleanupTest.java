package com.vibeflows.dataserver.repositories.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.vibeflows.dataserver.core.DataCollection;
import com.vibeflows.dataserver.core.GatewayConfig;
import com.vibeflows.dataserver.core.StoreException;
import de.bwaldvogel.mongo.MongoServer;
import de.bwaldvogel.mongo.backend.memory.MemoryBackend;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Retention sweep across every collection.
 */
public class MongoCleanupTest {
    private static final Instant NOW = Instant.parse("2026-06-15T00:00:00Z");

    private static MongoServer server;
    private static String connectionString;

    private MongoStore mongo;
    private MongoDocumentStore store;

    @BeforeAll
    static void startMongo() {
        server = new MongoServer(new MemoryBackend());
        connectionString = server.bindAndGetConnectionString();
    }

    @AfterAll
    static void stopMongo() {
        server.shutdown();
    }

    @BeforeEach
    void init() {
        mongo = MongoStore.connect(GatewayConfig.builder()
                .connectionString(connectionString)
                .databaseName("test_" + UUID.randomUUID().toString().replace("-", ""))
                .build());
        store = new MongoDocumentStore(mongo, (collection, actorId, query) -> query, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        mongo.close();
    }

    private void seedEveryCollection(int ageInDays, String suffix) {
        Date createdAt = Date.from(NOW.minus(ageInDays, ChronoUnit.DAYS));
        for (DataCollection collection : DataCollection.values()) {
            store.insert(collection, new Document("created_at", createdAt)
                    .append("user_id", "user-" + suffix)
                    .append("email", suffix + "@example.com")
                    .append("name", "name-" + suffix)
                    .append("type", "system"));
        }
    }

    private long total() {
        long count = 0;
        for (DataCollection collection : DataCollection.values()) {
            count += mongo.collection(collection).countDocuments();
        }
        return count;
    }

    @Test
    void cleanup_shouldRemoveEverything_whenAllDocumentsAreOlderThanTheHorizon() {
        seedEveryCollection(31, "a");
        seedEveryCollection(400, "b");

        Map<DataCollection, Long> deleted = store.cleanup(30);

        assertEquals(0, total());
        for (DataCollection collection : DataCollection.values()) {
            assertEquals(2L, deleted.get(collection));
        }
    }

    @Test
    void cleanup_shouldRemoveNothing_whenAllDocumentsAreNewerThanTheHorizon() {
        seedEveryCollection(29, "a");
        seedEveryCollection(0, "b");

        Map<DataCollection, Long> deleted = store.cleanup(30);

        assertEquals(2L * DataCollection.values().length, total());
        deleted.values().forEach(count -> assertEquals(0L, count));
    }

    @Test
    void cleanup_shouldOnlyRemoveDocumentsPastTheHorizon() {
        seedEveryCollection(45, "old");
        seedEveryCollection(5, "new");

        store.cleanup(30);

        for (DataCollection collection : DataCollection.values()) {
            assertEquals(1, mongo.collection(collection).countDocuments(new Document("user_id", "user-new")));
            assertEquals(0, mongo.collection(collection).countDocuments(new Document("user_id", "user-old")));
        }
    }

    @Test
    void cleanup_shouldRejectANegativeHorizon() {
        assertThrows(IllegalArgumentException.class, () -> store.cleanup(-1));
    }

    @Test
    @SuppressWarnings("unchecked")
    void cleanup_shouldAbortTheSweep_whenACollectionFails() {
        seedEveryCollection(60, "old");

        MongoCollection<Document> broken = mock(MongoCollection.class);
        when(broken.deleteMany(any(Bson.class))).thenThrow(new MongoException("disk full"));
        MongoStore failing = mock(MongoStore.class);
        when(failing.collection(any(DataCollection.class))).thenAnswer(invocation -> {
            DataCollection collection = invocation.getArgument(0);
            return collection == DataCollection.CHATS ? broken : mongo.collection(collection);
        });
        MongoDocumentStore sweeping = new MongoDocumentStore(failing, (c, a, q) -> q, Clock.fixed(NOW, ZoneOffset.UTC));

        StoreException e = assertThrows(StoreException.class, () -> sweeping.cleanup(30));

        assertEquals(DataCollection.CHATS, e.getCollection());
        assertEquals(0, mongo.collection(DataCollection.USERS).countDocuments());
        assertEquals(0, mongo.collection(DataCollection.TEAMS).countDocuments());
        assertEquals(1, mongo.collection(DataCollection.SESSIONS).countDocuments());
        assertEquals(1, mongo.collection(DataCollection.AGENTS).countDocuments());
    }
}

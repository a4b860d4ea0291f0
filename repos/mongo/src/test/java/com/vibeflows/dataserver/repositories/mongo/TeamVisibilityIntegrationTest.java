package com.vibeflows.dataserver.repositories.mongo;

import com.vibeflows.dataserver.auth.teams.TeamVisibility;
import com.vibeflows.dataserver.core.DataCollection;
import com.vibeflows.dataserver.core.FindOptions;
import com.vibeflows.dataserver.core.GatewayConfig;
import de.bwaldvogel.mongo.MongoServer;
import de.bwaldvogel.mongo.backend.memory.MemoryBackend;
import org.bson.Document;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Team based visibility running against a live store and resolver.
 */
public class TeamVisibilityIntegrationTest {
    private static MongoServer server;
    private static String connectionString;

    private MongoStore mongo;
    private MongoDocumentStore store;

    private String teamId;
    private String ownChat;
    private String sharedChat;
    private String teamChat;
    private String hiddenChat;

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
        store = new MongoDocumentStore(mongo, new TeamVisibility(new MongoTeamResolver(mongo), "admin"));

        teamId = store.insert(DataCollection.TEAMS, new Document("name", "research")
                .append("owner_id", "carol")
                .append("users", List.of("carol", "alice")));
        store.insert(DataCollection.TEAMS, new Document("name", "other")
                .append("owner_id", "dave")
                .append("users", List.of("dave")));

        ownChat = chat("alice", List.of(), null);
        sharedChat = chat("bob", List.of("alice"), null);
        teamChat = chat("carol", List.of(), teamId);
        hiddenChat = chat("dave", List.of("erin"), null);

        for (String chatId : List.of(ownChat, sharedChat, teamChat, hiddenChat)) {
            store.insert(DataCollection.MESSAGES, new Document("chat_id", chatId)
                    .append("sender_id", "someone")
                    .append("content", "hello " + chatId));
        }
    }

    @AfterEach
    void tearDown() {
        mongo.close();
    }

    private String chat(String owner, List<String> accessUsers, String team) {
        return store.insert(DataCollection.CHATS, new Document("user_id", owner)
                .append("access_users", accessUsers)
                .append("team_id", team));
    }

    private Set<String> ids(List<Document> documents) {
        return documents.stream().map(d -> d.getString("_id")).collect(Collectors.toSet());
    }

    private Set<String> chatIds(List<Document> messages) {
        return messages.stream().map(d -> d.getString("chat_id")).collect(Collectors.toSet());
    }

    @Test
    void chats_shouldBeVisible_whenOwnedSharedOrInAMemberTeam() {
        List<Document> visible = store.find(DataCollection.CHATS, new Document(), "alice", FindOptions.defaults());

        assertEquals(Set.of(ownChat, sharedChat, teamChat), ids(visible));
    }

    @Test
    void chats_shouldHonourTheCallerQuery_alongsideVisibility() {
        List<Document> visible = store.find(DataCollection.CHATS, new Document("user_id", "dave"), "alice", FindOptions.defaults());

        assertTrue(visible.isEmpty());
    }

    @Test
    void messages_shouldBeVisible_onlyInVisibleChats() {
        List<Document> visible = store.find(DataCollection.MESSAGES, new Document(), "alice", FindOptions.defaults());

        assertEquals(Set.of(ownChat, sharedChat, teamChat), chatIds(visible));
    }

    @Test
    void messages_shouldBeHidden_fromAnActorWithNoChats() {
        assertTrue(store.find(DataCollection.MESSAGES, new Document(), "mallory", FindOptions.defaults()).isEmpty());
    }

    @Test
    void admin_shouldSeeEverything() {
        assertEquals(4, store.find(DataCollection.CHATS, new Document(), "admin", FindOptions.defaults()).size());
        assertEquals(4, store.find(DataCollection.MESSAGES, new Document(), "admin", FindOptions.defaults()).size());
    }

    @Test
    void teams_shouldNotBeFiltered() {
        assertEquals(2, store.find(DataCollection.TEAMS, new Document(), "mallory", FindOptions.defaults()).size());
    }
}

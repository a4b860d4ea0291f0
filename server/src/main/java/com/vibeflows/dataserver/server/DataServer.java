package com.vibeflows.dataserver.server;

import com.vibeflows.dataserver.accounts.TeamService;
import com.vibeflows.dataserver.accounts.UserDirectory;
import com.vibeflows.dataserver.auth.teams.TeamVisibility;
import com.vibeflows.dataserver.core.AgentStatus;
import com.vibeflows.dataserver.core.AgentType;
import com.vibeflows.dataserver.core.DataCollection;
import com.vibeflows.dataserver.core.DocumentStore;
import com.vibeflows.dataserver.core.FindOptions;
import com.vibeflows.dataserver.core.GatewayConfig;
import com.vibeflows.dataserver.core.Result;
import com.vibeflows.dataserver.registry.AgentDefaults;
import com.vibeflows.dataserver.registry.AgentRegistration;
import com.vibeflows.dataserver.registry.AgentRegistry;
import com.vibeflows.dataserver.repositories.mongo.MongoDocumentStore;
import com.vibeflows.dataserver.repositories.mongo.MongoStore;
import com.vibeflows.dataserver.repositories.mongo.MongoTeamResolver;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for callers of the gateway. Wires the store, visibility, agent registry
 * and account services from one {@link GatewayConfig} and holds the only connection.
 *
 * Safe for concurrent use; nothing here is mutated after construction.
 */
public class DataServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DataServer.class);

    private final GatewayConfig config;
    private final MongoStore mongo;
    private final DocumentStore store;
    private final AgentRegistry agents;
    private final TeamService teams;
    private final UserDirectory users;

    public DataServer(GatewayConfig config) {
        this(config, AgentDefaults.RESOURCE);
    }

    DataServer(GatewayConfig config, String agentDefaultsResource) {
        this.config = config;
        this.mongo = MongoStore.connect(config);
        try {
            this.store = new MongoDocumentStore(mongo,
                    new TeamVisibility(new MongoTeamResolver(mongo), config.adminId()));
            this.agents = new AgentRegistry(store, AgentDefaults.load(agentDefaultsResource));
            this.teams = new TeamService(store, config.adminId());
            this.users = new UserDirectory(store, config.adminId());
        } catch (RuntimeException e) {
            logger.error("Failed to start data server: {}", e.getMessage(), e);
            mongo.close();
            throw e;
        }
        logger.info("Data server ready on database {} with {} day retention",
                config.databaseName(), config.retentionDays());
    }

    /**
     * Configured from the process environment.
     */
    public static DataServer fromEnvironment() {
        return new DataServer(GatewayConfig.fromEnvironment(System.getenv()));
    }

    // ==== documents ====

    public String insertDocument(DataCollection collection, Document document) {
        return store.insert(collection, document);
    }

    /**
     * @param actorId who is reading; {@code null} reads without visibility restrictions
     */
    public List<Document> findDocuments(DataCollection collection, Bson query, String actorId, FindOptions options) {
        return store.find(collection, query, actorId, options);
    }

    public List<Document> findDocuments(DataCollection collection, Bson query, String actorId) {
        return findDocuments(collection, query, actorId,
                FindOptions.defaults().withSort(collection.defaultSort()));
    }

    public boolean updateDocument(DataCollection collection, Bson query, Document patch) {
        return store.update(collection, query, patch);
    }

    public boolean deleteDocument(DataCollection collection, Bson query) {
        return store.delete(collection, query);
    }

    /**
     * Resolves a collection by its stored name.
     *
     * @throws IllegalArgumentException for a name the gateway does not manage
     */
    public static DataCollection collection(String name) {
        return DataCollection.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown collection: " + name));
    }

    // ==== agents ====

    public Result<String> registerAgent(AgentRegistration registration) {
        return agents.register(registration);
    }

    public Optional<Document> getAgentRegistration(String actorId, String name, AgentType type) {
        return agents.getRegistration(actorId, name, type);
    }

    public List<Document> listRegisteredAgents(String actorId, AgentType type, AgentStatus status) {
        return agents.listRegistrations(actorId, type, status);
    }

    // ==== accounts ====

    public TeamService teams() {
        return teams;
    }

    public UserDirectory users() {
        return users;
    }

    // ==== maintenance ====

    /**
     * Sweeps with the configured retention horizon.
     */
    public Map<DataCollection, Long> cleanup() {
        return cleanup(config.retentionDays());
    }

    public Map<DataCollection, Long> cleanup(int retentionDays) {
        Map<DataCollection, Long> deleted = store.cleanup(retentionDays);
        logger.info("Cleanup removed {} documents older than {} days",
                deleted.values().stream().mapToLong(Long::longValue).sum(), retentionDays);
        return deleted;
    }

    public boolean isHealthy() {
        return mongo.ping();
    }

    public GatewayConfig config() {
        return config;
    }

    @Override
    public void close() {
        logger.info("Stopping data server");
        mongo.close();
    }
}

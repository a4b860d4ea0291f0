package com.vibeflows.dataserver.registry;

import com.mongodb.client.model.Filters;
import com.vibeflows.dataserver.core.AgentStatus;
import com.vibeflows.dataserver.core.AgentType;
import com.vibeflows.dataserver.core.DataCollection;
import com.vibeflows.dataserver.core.DocumentStore;
import com.vibeflows.dataserver.core.FindOptions;
import com.vibeflows.dataserver.core.GatewayError;
import com.vibeflows.dataserver.core.Ids;
import com.vibeflows.dataserver.core.Result;
import com.vibeflows.dataserver.core.StoreException;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Creates and upgrades versioned agents. An agent is identified by its owner, name and
 * type; registering an existing identity upgrades it in place instead of adding a
 * second document.
 */
public class AgentRegistry {
    private static final Logger logger = LoggerFactory.getLogger(AgentRegistry.class);

    private final DocumentStore store;
    private final AgentDefaults defaults;

    public AgentRegistry(DocumentStore store, AgentDefaults defaults) {
        this.store = store;
        this.defaults = defaults;
    }

    public AgentRegistry(DocumentStore store) {
        this(store, AgentDefaults.load());
    }

    /**
     * Registers or upgrades an agent.
     *
     * @return the agent's id, or a {@link GatewayError.ValidationError} for bad input or a
     * concurrent duplicate, or a {@link GatewayError.RegistrationError} when the upgrade
     * did not take effect
     * @throws StoreException when the store fails for any other reason
     */
    public Result<String> register(AgentRegistration registration) {
        Optional<AgentType> type = AgentType.fromValue(registration.type());
        if (type.isEmpty()) {
            return Result.failure(new GatewayError.ValidationError("invalid_type",
                    "Invalid agent type: " + registration.type() + ". Must be one of " + typeNames()));
        }
        if (!SemanticVersion.isValid(registration.version())) {
            return Result.failure(new GatewayError.ValidationError("invalid_version",
                    "Version must follow semantic versioning (e.g. 1.0.0), got: " + registration.version()));
        }
        Optional<String> missing = missingField(registration);
        if (missing.isPresent()) {
            return Result.failure(new GatewayError.ValidationError("missing_field",
                    "Missing required field: " + missing.get()));
        }

        Document config = new Document(defaults.merge(type.get(), registration.config()));
        Optional<Document> existing = store.findOne(DataCollection.AGENTS,
                identity(registration.actorId(), registration.name(), type.get()));

        if (existing.isPresent()) {
            return upgrade(existing.get(), registration, config);
        }
        return create(registration, type.get(), config);
    }

    private Result<String> upgrade(Document existing, AgentRegistration registration, Document config) {
        String id = existing.getString("_id");
        Document patch = new Document("version", registration.version())
                .append("config", config)
                .append("system_message", registration.systemMessage())
                .append("src", registration.src())
                .append("command", registration.command())
                .append("description", registration.description())
                .append("last_active", new Date());
        if (registration.capabilities() != null) {
            patch.append("capabilities", new ArrayList<>(registration.capabilities()));
        }
        if (registration.metadata() != null) {
            patch.append("metadata", new Document(registration.metadata()));
        }

        if (!store.update(DataCollection.AGENTS, Ids.byId(id), patch)) {
            logger.error("Upgrade of agent {} ({}) to {} modified nothing", registration.name(), id, registration.version());
            return Result.failure(new GatewayError.RegistrationError("update_failed",
                    "Failed to update agent " + registration.name()));
        }
        logger.info("Upgraded agent {} for {} to {}", registration.name(), registration.actorId(), registration.version());
        return Result.success(id);
    }

    private Result<String> create(AgentRegistration registration, AgentType type, Document config) {
        Document agent = new Document("user_id", registration.actorId())
                .append("name", registration.name())
                .append("type", type.value())
                .append("version", registration.version())
                .append("config", config)
                .append("system_message", registration.systemMessage())
                .append("src", registration.src())
                .append("command", registration.command())
                .append("description", registration.description())
                .append("capabilities", registration.capabilities() != null
                        ? new ArrayList<>(registration.capabilities()) : new ArrayList<>())
                .append("metadata", registration.metadata() != null
                        ? new Document(registration.metadata()) : new Document())
                .append("status", AgentStatus.ACTIVE.value())
                .append("creator_id", registration.actorId());

        try {
            String id = store.insert(DataCollection.AGENTS, agent);
            logger.info("Registered agent {} ({}) for {}", registration.name(), type.value(), registration.actorId());
            return Result.success(id);
        } catch (StoreException e) {
            if (e.isDuplicateKey()) {
                logger.warn("Concurrent registration of agent {} for {}", registration.name(), registration.actorId());
                return Result.failure(new GatewayError.ValidationError("duplicate_agent",
                        "agent already exists for this user"));
            }
            throw e;
        }
    }

    /**
     * @return the agent, or empty when the actor has no agent of that name and type
     */
    public Optional<Document> getRegistration(String actorId, String name, AgentType type) {
        return store.findOne(DataCollection.AGENTS, identity(actorId, name, type));
    }

    /**
     * The actor's agents, most recently active first.
     *
     * @param type   optional filter
     * @param status optional filter
     */
    public List<Document> listRegistrations(String actorId, AgentType type, AgentStatus status) {
        List<Bson> filters = new ArrayList<>();
        filters.add(Filters.eq("user_id", actorId));
        if (type != null) {
            filters.add(Filters.eq("type", type.value()));
        }
        if (status != null) {
            filters.add(Filters.eq("status", status.value()));
        }
        return store.find(DataCollection.AGENTS, Filters.and(filters), null,
                FindOptions.defaults().withSort(DataCollection.AGENTS.defaultSort()));
    }

    private static Bson identity(String actorId, String name, AgentType type) {
        return Filters.and(
                Filters.eq("user_id", actorId),
                Filters.eq("name", name),
                Filters.eq("type", type.value()));
    }

    private static Optional<String> missingField(AgentRegistration registration) {
        if (isBlank(registration.actorId())) {
            return Optional.of("actor_id");
        }
        if (isBlank(registration.name())) {
            return Optional.of("name");
        }
        if (registration.systemMessage() == null) {
            return Optional.of("system_message");
        }
        if (registration.src() == null) {
            return Optional.of("src");
        }
        if (registration.command() == null) {
            return Optional.of("command");
        }
        return Optional.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String typeNames() {
        return Arrays.stream(AgentType.values()).map(AgentType::value).collect(Collectors.joining(", "));
    }
}

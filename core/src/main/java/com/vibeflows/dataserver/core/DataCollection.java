package com.vibeflows.dataserver.core;

import com.mongodb.client.model.Sorts;
import org.bson.conversions.Bson;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The collections served by the gateway. Each one carries its index set, the rule
 * used to narrow reads and the activity field the store keeps current.
 */
public enum DataCollection {
    USERS("users", VisibilityRule.UNRESTRICTED, null, "created_at", List.of(
            IndexSpec.unique("email"),
            IndexSpec.unique("user_id"),
            IndexSpec.descending("created_at"))),

    TEAMS("teams", VisibilityRule.UNRESTRICTED, null, "created_at", List.of(
            IndexSpec.ascending("owner_id"),
            IndexSpec.ascending("users"),
            IndexSpec.descending("created_at"))),

    CHATS("chats", VisibilityRule.OWNER_SHARED_OR_TEAM, null, "created_at", List.of(
            IndexSpec.ascending("user_id"),
            IndexSpec.ascending("session_id"),
            IndexSpec.ascending("team_id"),
            IndexSpec.ascending("access_users"),
            IndexSpec.descending("created_at"))),

    SESSIONS("sessions", VisibilityRule.CHAT_MEMBERSHIP, null, "timestamp", List.of(
            IndexSpec.ascending("chat_id"),
            IndexSpec.ascending("user_id"),
            IndexSpec.ascending("status"),
            IndexSpec.descending("created_at"))),

    MESSAGES("messages", VisibilityRule.CHAT_MEMBERSHIP, null, "timestamp", List.of(
            IndexSpec.ascending("chat_id"),
            IndexSpec.ascending("session_id"),
            IndexSpec.ascending("sender_id"),
            IndexSpec.ascending("type"),
            IndexSpec.descending("timestamp"),
            IndexSpec.descending("created_at"))),

    WORKFLOWS("workflows", VisibilityRule.OWNER_OR_TEAM, "timestamp", "timestamp", List.of(
            IndexSpec.ascending("user_id"),
            IndexSpec.ascending("chat_id"),
            IndexSpec.ascending("team_id"),
            IndexSpec.ascending("status"),
            IndexSpec.ascending("version"),
            IndexSpec.descending("timestamp"),
            IndexSpec.descending("created_at"))),

    AGENTS("agents", VisibilityRule.OWNER_OR_TEAM, "last_active", "last_active", List.of(
            IndexSpec.ascending("user_id"),
            IndexSpec.ascending("team_id"),
            IndexSpec.ascending("type"),
            IndexSpec.ascending("version"),
            IndexSpec.ascending("status"),
            IndexSpec.ascending("user_id", "version"),
            IndexSpec.ascending("user_id", "type"),
            // one registration per (owner, name, type)
            IndexSpec.unique("user_id", "name", "type"),
            IndexSpec.descending("last_active"),
            IndexSpec.descending("created_at")));

    private final String collectionName;
    private final VisibilityRule visibilityRule;
    private final String activityField;
    private final String defaultSortField;
    private final List<IndexSpec> indexes;

    DataCollection(String collectionName,
                   VisibilityRule visibilityRule,
                   String activityField,
                   String defaultSortField,
                   List<IndexSpec> indexes) {
        this.collectionName = collectionName;
        this.visibilityRule = visibilityRule;
        this.activityField = activityField;
        this.defaultSortField = defaultSortField;
        this.indexes = indexes;
    }

    public String collectionName() {
        return collectionName;
    }

    public VisibilityRule visibilityRule() {
        return visibilityRule;
    }

    /**
     * Timestamp the store owns on this collection ({@code timestamp} for workflows,
     * {@code last_active} for agents). Stamped on insert when absent and never
     * accepted from a caller on update.
     */
    public Optional<String> activityField() {
        return Optional.ofNullable(activityField);
    }

    /**
     * Newest-first ordering used by listings of this collection.
     */
    public Bson defaultSort() {
        return Sorts.descending(defaultSortField);
    }

    public List<IndexSpec> indexes() {
        return indexes;
    }

    public static Optional<DataCollection> fromName(String name) {
        return Arrays.stream(values())
                .filter(c -> c.collectionName.equals(name))
                .findFirst();
    }
}

package com.vibeflows.dataserver.repositories.mongo;

import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.vibeflows.dataserver.core.DataCollection;
import com.vibeflows.dataserver.core.Ids;
import com.vibeflows.dataserver.core.TeamResolver;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resolves team and chat membership straight from the teams and chats collections.
 *
 * A failed lookup is logged and answered with an empty set so the read that asked
 * for it still runs, with no team-granted access.
 */
public class MongoTeamResolver implements TeamResolver {
    private static final Logger logger = LoggerFactory.getLogger(MongoTeamResolver.class);

    private final MongoCollection<Document> teams;
    private final MongoCollection<Document> chats;

    public MongoTeamResolver(MongoCollection<Document> teams, MongoCollection<Document> chats) {
        this.teams = teams;
        this.chats = chats;
    }

    public MongoTeamResolver(MongoStore store) {
        this(store.collection(DataCollection.TEAMS), store.collection(DataCollection.CHATS));
    }

    @Override
    public Set<String> teamsFor(String actorId) {
        try {
            return ids(teams, Filters.or(
                    Filters.eq("owner_id", actorId),
                    Filters.eq("users", actorId)));
        } catch (Exception e) {
            logger.error("Failed to get teams for {}: {}", actorId, e.getMessage(), e);
            return Collections.emptySet();
        }
    }

    @Override
    public Set<String> chatIdsFor(String actorId) {
        Set<String> teamIds = teamsFor(actorId);
        try {
            return ids(chats, Filters.or(
                    Filters.eq("user_id", actorId),
                    Filters.eq("access_users", actorId),
                    Filters.in("team_id", new ArrayList<>(teamIds))));
        } catch (Exception e) {
            logger.error("Failed to get chat ids for {}: {}", actorId, e.getMessage(), e);
            return Collections.emptySet();
        }
    }

    private static Set<String> ids(MongoCollection<Document> collection, Bson filter) {
        Set<String> ids = new LinkedHashSet<>();
        for (Document doc : collection.find(filter).projection(Projections.include("_id"))) {
            ids.add(Ids.normalize(doc.get("_id")));
        }
        return ids;
    }
}

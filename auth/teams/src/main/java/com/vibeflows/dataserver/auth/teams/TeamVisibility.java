package com.vibeflows.dataserver.auth.teams;

import com.mongodb.MongoClientSettings;
import com.mongodb.client.model.Filters;
import com.vibeflows.dataserver.core.DataCollection;
import com.vibeflows.dataserver.core.TeamResolver;
import com.vibeflows.dataserver.core.Visibility;
import org.bson.BsonDocument;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Visibility based on ownership, explicit sharing and team membership.
 *
 * The admin sentinel sees everything. Every other actor gets the collection's
 * access predicate ANDed onto its own query:
 * <ul>
 *   <li>chats: owner, listed in {@code access_users}, or chat team is one of the actor's teams</li>
 *   <li>workflows, agents: owner or team</li>
 *   <li>messages, sessions: {@code chat_id} among the chats the actor can see</li>
 *   <li>users, teams: unchanged</li>
 * </ul>
 * Membership is resolved on every call and never cached, since teams change
 * between requests.
 */
public class TeamVisibility implements Visibility {
    private static final Logger logger = LoggerFactory.getLogger(TeamVisibility.class);

    private final TeamResolver resolver;
    private final String adminId;

    /**
     * @param resolver team and chat membership lookups
     * @param adminId  actor id that bypasses all filtering
     */
    public TeamVisibility(TeamResolver resolver, String adminId) {
        this.resolver = resolver;
        this.adminId = adminId;
    }

    @Override
    public Bson augment(DataCollection collection, String actorId, Bson query) {
        if (actorId == null || actorId.equals(adminId)) {
            return query;
        }

        Bson predicate = accessPredicate(collection, actorId);
        if (predicate == null) {
            return query;
        }

        logger.debug("Restricting {} read for actor {}", collection.collectionName(), actorId);
        return isEmpty(query) ? predicate : Filters.and(query, predicate);
    }

    private Bson accessPredicate(DataCollection collection, String actorId) {
        switch (collection.visibilityRule()) {
            case OWNER_SHARED_OR_TEAM:
                return Filters.or(
                        Filters.eq("user_id", actorId),
                        Filters.eq("access_users", actorId),
                        Filters.in("team_id", asList(resolver.teamsFor(actorId))));
            case OWNER_OR_TEAM:
                return Filters.or(
                        Filters.eq("user_id", actorId),
                        Filters.in("team_id", asList(resolver.teamsFor(actorId))));
            case CHAT_MEMBERSHIP:
                return Filters.in("chat_id", asList(resolver.chatIdsFor(actorId)));
            case UNRESTRICTED:
            default:
                return null;
        }
    }

    // sorted so the same membership always renders the same query
    private static List<String> asList(Set<String> ids) {
        return new ArrayList<>(new TreeSet<>(ids));
    }

    private static boolean isEmpty(Bson query) {
        if (query == null) {
            return true;
        }
        if (query instanceof Document) {
            return ((Document) query).isEmpty();
        }
        return query.toBsonDocument(BsonDocument.class, MongoClientSettings.getDefaultCodecRegistry()).isEmpty();
    }
}

package com.vibeflows.dataserver.accounts;

import com.mongodb.client.model.Filters;
import com.vibeflows.dataserver.core.DataCollection;
import com.vibeflows.dataserver.core.DocumentStore;
import com.vibeflows.dataserver.core.FindOptions;
import com.vibeflows.dataserver.core.GatewayError;
import com.vibeflows.dataserver.core.Ids;
import com.vibeflows.dataserver.core.Result;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Team lifecycle and membership. Owners and the admin manage a team; members may
 * only read it.
 */
public class TeamService {
    private static final Logger logger = LoggerFactory.getLogger(TeamService.class);

    static final Set<String> UPDATABLE_FIELDS = Set.of("name", "description", "metadata");

    private final DocumentStore store;
    private final String adminId;

    public TeamService(DocumentStore store, String adminId) {
        this.store = store;
        this.adminId = adminId;
    }

    /**
     * Creates a team owned by {@code actorId}, who is also added to its members.
     *
     * @return the new team's id
     */
    public Result<String> createTeam(String actorId, String name, String description,
                                     List<String> users, Map<String, Object> metadata) {
        if (name == null || name.isBlank()) {
            return Result.failure(new GatewayError.ValidationError("missing_field", "Missing required field: name"));
        }

        List<String> members = users != null ? new ArrayList<>(users) : new ArrayList<>();
        if (!members.contains(actorId)) {
            members.add(actorId);
        }

        Document team = new Document("name", name)
                .append("description", description)
                .append("owner_id", actorId)
                .append("users", members)
                .append("metadata", metadata != null ? new Document(metadata) : new Document())
                .append("creator_id", actorId);
        String id = store.insert(DataCollection.TEAMS, team);
        logger.info("Team {} ({}) created by {}", name, id, actorId);
        return Result.success(id);
    }

    public Result<Document> getTeam(String actorId, String teamId) {
        Optional<Document> team = load(teamId);
        if (team.isEmpty()) {
            return notFound(teamId);
        }
        if (!isAdmin(actorId) && !isOwner(team.get(), actorId) && !isMember(team.get(), actorId)) {
            return Result.failure(new GatewayError.ForbiddenError("forbidden", "Not authorized to access this team"));
        }
        return Result.success(team.get());
    }

    /**
     * Teams the actor owns or belongs to, newest first.
     */
    public List<Document> listTeams(String actorId) {
        return store.find(DataCollection.TEAMS,
                Filters.or(Filters.eq("owner_id", actorId), Filters.eq("users", actorId)),
                actorId,
                FindOptions.defaults().withSort(DataCollection.TEAMS.defaultSort()));
    }

    /**
     * Changes the team's name, description or metadata. Other keys in {@code changes}
     * are ignored.
     *
     * @return the updated team
     */
    public Result<Document> updateTeam(String actorId, String teamId, Map<String, Object> changes) {
        Document patch = new Document();
        if (changes != null) {
            changes.forEach((key, value) -> {
                if (UPDATABLE_FIELDS.contains(key)) {
                    patch.put(key, value);
                }
            });
        }
        if (patch.isEmpty()) {
            return Result.failure(new GatewayError.ValidationError("no_changes", "No changes made to team"));
        }
        if (patch.containsKey("name") && !isNonBlankString(patch.get("name"))) {
            return Result.failure(new GatewayError.ValidationError("invalid_name", "Team name must not be blank"));
        }

        Result<Document> owned = ownedTeam(actorId, teamId, "Only team owner can update team");
        if (!owned.isSuccess()) {
            return owned;
        }
        if (!store.update(DataCollection.TEAMS, Ids.byId(teamId), patch)) {
            return Result.failure(new GatewayError.ValidationError("no_changes", "No changes made to team"));
        }
        logger.info("Team {} updated by {}: {}", teamId, actorId, patch.keySet());
        return reload(teamId);
    }

    public Result<Boolean> deleteTeam(String actorId, String teamId) {
        Result<Document> owned = ownedTeam(actorId, teamId, "Only team owner can delete team");
        if (!owned.isSuccess()) {
            return Result.failure(owned.getError());
        }
        if (!store.delete(DataCollection.TEAMS, Ids.byId(teamId))) {
            return notFound(teamId);
        }
        logger.info("Team {} deleted by {}", teamId, actorId);
        return Result.success(true);
    }

    /**
     * @return the team with the member added
     */
    public Result<Document> addMember(String actorId, String teamId, String memberId) {
        Result<Document> owned = ownedTeam(actorId, teamId, "Only team owner can add members");
        if (!owned.isSuccess()) {
            return owned;
        }
        if (isMember(owned.getValue(), memberId)) {
            return Result.failure(new GatewayError.ValidationError("already_member",
                    "User " + memberId + " is already in team"));
        }

        Document patch = new Document("$addToSet", new Document("users", memberId));
        if (!store.update(DataCollection.TEAMS, Ids.byId(teamId), patch)) {
            return Result.failure(new GatewayError.ValidationError("already_member",
                    "User already in team or failed to add"));
        }
        logger.info("User {} added to team {} by {}", memberId, teamId, actorId);
        return reload(teamId);
    }

    /**
     * @return the team with the member removed
     */
    public Result<Document> removeMember(String actorId, String teamId, String memberId) {
        Result<Document> owned = ownedTeam(actorId, teamId, "Only team owner can remove members");
        if (!owned.isSuccess()) {
            return owned;
        }
        if (isOwner(owned.getValue(), memberId)) {
            return Result.failure(new GatewayError.ValidationError("owner_removal", "Cannot remove team owner"));
        }
        if (!isMember(owned.getValue(), memberId)) {
            return Result.failure(new GatewayError.ValidationError("not_member",
                    "User " + memberId + " is not in team"));
        }

        List<Object> forms = new ArrayList<>(List.of(memberId));
        if (ObjectId.isValid(memberId)) {
            forms.add(new ObjectId(memberId));
        }
        Document patch = new Document("$pull", new Document("users", new Document("$in", forms)));
        if (!store.update(DataCollection.TEAMS, Ids.byId(teamId), patch)) {
            return Result.failure(new GatewayError.ValidationError("not_member",
                    "User not in team or failed to remove"));
        }
        logger.info("User {} removed from team {} by {}", memberId, teamId, actorId);
        return reload(teamId);
    }

    // ==== helpers ====

    private Result<Document> ownedTeam(String actorId, String teamId, String forbiddenMessage) {
        Optional<Document> team = load(teamId);
        if (team.isEmpty()) {
            return notFound(teamId);
        }
        if (!isAdmin(actorId) && !isOwner(team.get(), actorId)) {
            logger.warn("{} denied on team {}: {}", actorId, teamId, forbiddenMessage);
            return Result.failure(new GatewayError.ForbiddenError("forbidden", forbiddenMessage));
        }
        return Result.success(team.get());
    }

    private Optional<Document> load(String teamId) {
        return store.findOne(DataCollection.TEAMS, Ids.byId(teamId));
    }

    private Result<Document> reload(String teamId) {
        return load(teamId).<Result<Document>>map(Result::success).orElseGet(() -> notFound(teamId));
    }

    private static <T> Result<T> notFound(String teamId) {
        return Result.failure(new GatewayError.NotFoundError("not_found", "Team not found: " + teamId));
    }

    private boolean isAdmin(String actorId) {
        return adminId.equals(actorId);
    }

    private static boolean isOwner(Document team, String actorId) {
        return actorId != null && actorId.equals(Ids.normalize(team.get("owner_id")));
    }

    // members may be stored as ObjectIds when written through the generic gateway
    private static boolean isMember(Document team, String actorId) {
        List<Object> users = team.getList("users", Object.class);
        return users != null && actorId != null
                && users.stream().map(Ids::normalize).anyMatch(actorId::equals);
    }

    private static boolean isNonBlankString(Object value) {
        return value instanceof String && !((String) value).isBlank();
    }
}

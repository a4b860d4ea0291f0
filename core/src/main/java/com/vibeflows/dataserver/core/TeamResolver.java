package com.vibeflows.dataserver.core;

import java.util.Set;

/**
 * Read-only view of team and chat membership. Implementations never fail the
 * caller: a lookup that cannot be completed yields an empty set.
 */
public interface TeamResolver {
    /**
     * Teams the actor owns or is a member of.
     */
    Set<String> teamsFor(String actorId);

    /**
     * Chats the actor owns, was granted explicit access to, or shares through a team.
     */
    Set<String> chatIdsFor(String actorId);
}

package com.vibeflows.dataserver.core;

/**
 * How a collection narrows reads for a non-admin actor.
 */
public enum VisibilityRule {
    /** Owner, explicit {@code access_users} entry, or a team the actor belongs to. */
    OWNER_SHARED_OR_TEAM,
    /** Owner or a team the actor belongs to. */
    OWNER_OR_TEAM,
    /** Documents hanging off a chat the actor can see. */
    CHAT_MEMBERSHIP,
    /** Not narrowed here; callers enforce per-operation ownership. */
    UNRESTRICTED
}

package com.vibeflows.dataserver.core;

import org.bson.conversions.Bson;

/**
 * Narrows a read to the documents an actor is entitled to see.
 */
@FunctionalInterface
public interface Visibility {
    /**
     * @param collection collection being read
     * @param actorId    authenticated actor
     * @param query      the caller's own query; never widened
     * @return the query to run
     */
    Bson augment(DataCollection collection, String actorId, Bson query);
}

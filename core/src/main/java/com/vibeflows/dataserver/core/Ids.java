package com.vibeflows.dataserver.core;

import com.mongodb.client.model.Filters;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;

public interface Ids {

    /**
     * Filter on {@code _id}. Hex strings are matched as ObjectIds, anything else
     * verbatim.
     */
    static Bson byId(String id) {
        if (id != null && ObjectId.isValid(id)) {
            return Filters.eq("_id", new ObjectId(id));
        }
        return Filters.eq("_id", id);
    }

    static String normalize(Object id) {
        if (id == null) {
            return null;
        }
        if (id instanceof ObjectId) {
            return ((ObjectId) id).toHexString();
        }
        return id.toString();
    }
}

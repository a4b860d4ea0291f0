package com.vibeflows.dataserver.accounts;

import com.mongodb.client.model.Filters;
import com.vibeflows.dataserver.core.DataCollection;
import com.vibeflows.dataserver.core.DocumentStore;
import com.vibeflows.dataserver.core.FindOptions;
import org.bson.Document;

import java.util.List;
import java.util.Optional;

/**
 * User lookups. The admin sees the whole directory, everyone else only themselves.
 */
public class UserDirectory {
    private final DocumentStore store;
    private final String adminId;

    public UserDirectory(DocumentStore store, String adminId) {
        this.store = store;
        this.adminId = adminId;
    }

    public List<Document> listUsers(String actorId, FindOptions options) {
        if (adminId.equals(actorId)) {
            return store.find(DataCollection.USERS, new Document(), actorId, options);
        }
        return store.find(DataCollection.USERS, Filters.eq("user_id", actorId), actorId, options);
    }

    public List<Document> listUsers(String actorId) {
        return listUsers(actorId, FindOptions.defaults().withSort(DataCollection.USERS.defaultSort()));
    }

    public Optional<Document> findUser(String userId) {
        return store.findOne(DataCollection.USERS, Filters.eq("user_id", userId));
    }
}

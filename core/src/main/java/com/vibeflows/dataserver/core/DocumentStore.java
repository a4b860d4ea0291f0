package com.vibeflows.dataserver.core;

import org.bson.Document;
import org.bson.conversions.Bson;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generic document access over the gateway's collections. Every method is a single
 * document-level call against the store; failures of the store surface as
 * {@link StoreException}.
 */
public interface DocumentStore {

    /**
     * Inserts a document, stamping {@code created_at}, {@code updated_at} and the
     * collection's activity field when they are absent.
     *
     * @return the identifier assigned by the store, as a string
     */
    String insert(DataCollection collection, Document document);

    /**
     * Reads documents matching {@code query}. When {@code actorId} is given the query is
     * first narrowed to what that actor may see.
     *
     * @return matching documents with {@code _id} normalised to a string; empty when
     * nothing matches
     */
    List<Document> find(DataCollection collection, Bson query, String actorId, FindOptions options);

    default List<Document> find(DataCollection collection, Bson query) {
        return find(collection, query, null, FindOptions.defaults());
    }

    default Optional<Document> findOne(DataCollection collection, Bson query) {
        return find(collection, query, null, FindOptions.defaults().withLimit(1)).stream().findFirst();
    }

    /**
     * Applies {@code patch} to the first matching document. A patch made of update
     * operators ({@code $set}, {@code $addToSet}, ...) is applied as is; any other patch
     * is a set of field values. {@code updated_at} is always set to the current time,
     * and so is the activity field whenever the patch tries to set it. Any other
     * operator on those fields, and any change to {@code created_at}, is rejected.
     *
     * @return whether a document was modified
     * @throws IllegalArgumentException for a patch that touches bookkeeping fields
     */
    boolean update(DataCollection collection, Bson query, Document patch);

    /**
     * @return whether a document was removed
     */
    boolean delete(DataCollection collection, Bson query);

    /**
     * Deletes, in every collection, the documents created more than
     * {@code retentionDays} ago. Stops at the first collection that fails.
     *
     * @return deleted counts per collection
     */
    Map<DataCollection, Long> cleanup(int retentionDays);
}

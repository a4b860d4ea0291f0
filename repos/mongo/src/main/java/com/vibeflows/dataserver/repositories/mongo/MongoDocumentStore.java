package com.vibeflows.dataserver.repositories.mongo;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.WriteConcern;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import com.vibeflows.dataserver.core.DataCollection;
import com.vibeflows.dataserver.core.DocumentStore;
import com.vibeflows.dataserver.core.FindOptions;
import com.vibeflows.dataserver.core.Ids;
import com.vibeflows.dataserver.core.StoreException;
import com.vibeflows.dataserver.core.Visibility;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * MongoDB implementation of the DocumentStore. Each operation is one driver call;
 * nothing is retried here and no lock is held across calls.
 */
public class MongoDocumentStore implements DocumentStore {
    private static final Logger logger = LoggerFactory.getLogger(MongoDocumentStore.class);

    private final MongoStore store;
    private final Visibility visibility;
    private final Clock clock;

    public MongoDocumentStore(MongoStore store, Visibility visibility) {
        this(store, visibility, Clock.systemUTC());
    }

    /**
     * @param store      connection and collections
     * @param visibility narrows reads made on behalf of an actor
     * @param clock      source of the bookkeeping timestamps
     */
    public MongoDocumentStore(MongoStore store, Visibility visibility, Clock clock) {
        this.store = store;
        this.visibility = visibility;
        this.clock = clock;
    }

    @Override
    public String insert(DataCollection collection, Document document) {
        Objects.requireNonNull(document, "document");
        Date now = now();

        Document doc = new Document(document);
        doc.putIfAbsent("created_at", now);
        doc.putIfAbsent("updated_at", now);
        collection.activityField().ifPresent(field -> doc.putIfAbsent(field, now));

        try {
            store.collection(collection).withWriteConcern(WriteConcern.MAJORITY).insertOne(doc);
            return Ids.normalize(doc.get("_id"));
        } catch (MongoException e) {
            logger.error("Failed to insert document into {}: {}", collection.collectionName(), e.getMessage(), e);
            throw new StoreException("Failed to insert document", collection, isDuplicateKey(e), e);
        }
    }

    @Override
    public List<Document> find(DataCollection collection, Bson query, String actorId, FindOptions options) {
        Bson effective = actorId != null ? visibility.augment(collection, actorId, query) : query;
        if (effective == null) {
            effective = new Document();
        }
        FindOptions paging = options != null ? options : FindOptions.defaults();

        try {
            FindIterable<Document> cursor = store.collection(collection).find(effective);
            if (paging.sort() != null) {
                cursor = cursor.sort(paging.sort());
            }
            List<Document> results = cursor
                    .skip(paging.skip())
                    .limit(paging.limit())
                    .into(new ArrayList<>());

            results.forEach(Converters::normalizeId);
            return results;
        } catch (MongoException e) {
            logger.error("Failed to find documents in {}: {}", collection.collectionName(), e.getMessage(), e);
            throw new StoreException("Failed to find documents", collection, e);
        }
    }

    @Override
    public boolean update(DataCollection collection, Bson query, Document patch) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(patch, "patch");
        Date now = now();

        Set<String> bookkeeping = new HashSet<>(List.of(Converters.CREATED_AT, Converters.UPDATED_AT));
        collection.activityField().ifPresent(bookkeeping::add);

        Document update = Converters.toUpdate(patch, bookkeeping);
        Document set = update.get("$set", Document.class);
        set.put("updated_at", now);
        // bookkeeping, not client-settable
        collection.activityField()
                .filter(set::containsKey)
                .ifPresent(field -> set.put(field, now));

        try {
            UpdateResult result = store.collection(collection).updateOne(query, update);
            return result.getModifiedCount() > 0;
        } catch (MongoException e) {
            logger.error("Failed to update document in {}: {}", collection.collectionName(), e.getMessage(), e);
            throw new StoreException("Failed to update document", collection, isDuplicateKey(e), e);
        }
    }

    @Override
    public boolean delete(DataCollection collection, Bson query) {
        Objects.requireNonNull(query, "query");
        try {
            DeleteResult result = store.collection(collection).deleteOne(query);
            return result.getDeletedCount() > 0;
        } catch (MongoException e) {
            logger.error("Failed to delete document from {}: {}", collection.collectionName(), e.getMessage(), e);
            throw new StoreException("Failed to delete document", collection, e);
        }
    }

    @Override
    public Map<DataCollection, Long> cleanup(int retentionDays) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must not be negative: " + retentionDays);
        }
        Date cutoff = Date.from(clock.instant().minus(Duration.ofDays(retentionDays)));

        Map<DataCollection, Long> deleted = new EnumMap<>(DataCollection.class);
        for (DataCollection collection : DataCollection.values()) {
            MongoCollection<Document> mongoCollection = store.collection(collection);
            try {
                long count = mongoCollection.deleteMany(Filters.lt("created_at", cutoff)).getDeletedCount();
                deleted.put(collection, count);
                logger.info("Deleted {} old documents from {}", count, collection.collectionName());
            } catch (MongoException e) {
                logger.error("Failed to cleanup {}: {}", collection.collectionName(), e.getMessage(), e);
                throw new StoreException("Failed to cleanup old data", collection, e);
            }
        }
        return Collections.unmodifiableMap(deleted);
    }

    private Date now() {
        return Date.from(clock.instant());
    }

    private static boolean isDuplicateKey(MongoException e) {
        return ErrorCategory.fromErrorCode(e.getCode()) == ErrorCategory.DUPLICATE_KEY;
    }
}

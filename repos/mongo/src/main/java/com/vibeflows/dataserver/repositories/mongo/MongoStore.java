package com.vibeflows.dataserver.repositories.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.vibeflows.dataserver.core.DataCollection;
import com.vibeflows.dataserver.core.GatewayConfig;
import com.vibeflows.dataserver.core.IndexSpec;
import com.vibeflows.dataserver.core.StoreException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the pooled client and hands out the gateway's collections. The client is
 * thread-safe and shared by every request.
 */
public class MongoStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MongoStore.class);

    private final MongoClient client;
    private final MongoDatabase database;

    public MongoStore(MongoClient client, String databaseName) {
        this.client = client;
        this.database = client.getDatabase(databaseName);
    }

    /**
     * Connects and makes sure every collection's indexes exist.
     */
    public static MongoStore connect(GatewayConfig config) {
        MongoClient client;
        try {
            client = MongoClients.create(config.connectionString());
        } catch (MongoException | IllegalArgumentException e) {
            logger.error("Failed to connect to MongoDB: {}", e.getMessage(), e);
            throw new StoreException("Failed to connect to MongoDB", null, e);
        }

        MongoStore store = new MongoStore(client, config.databaseName());
        logger.info("Connected to MongoDB: {}", config.databaseName());
        try {
            store.ensureIndexes();
        } catch (StoreException e) {
            store.close();
            throw e;
        }
        return store;
    }

    public MongoCollection<Document> collection(DataCollection collection) {
        return database.getCollection(collection.collectionName());
    }

    public void ensureIndexes() {
        for (DataCollection collection : DataCollection.values()) {
            MongoCollection<Document> mongoCollection = collection(collection);
            for (IndexSpec spec : collection.indexes()) {
                try {
                    mongoCollection.createIndex(Converters.indexKeys(spec), new IndexOptions().unique(spec.unique()));
                } catch (MongoException e) {
                    logger.error("Failed to create index {} on {}: {}",
                            spec.fields(), collection.collectionName(), e.getMessage(), e);
                    throw new StoreException("Failed to create indexes", collection, e);
                }
            }
        }
        logger.info("Created indexes for all collections");
    }

    /**
     * @return whether the database answered a ping
     */
    public boolean ping() {
        try {
            database.runCommand(new Document("ping", 1));
            return true;
        } catch (MongoException e) {
            logger.warn("MongoDB ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        client.close();
        logger.info("Closed MongoDB connection");
    }
}

package com.vibeflows.dataserver.core;

/**
 * The underlying store could not complete an operation: connectivity, a constraint
 * violation or any other driver failure. Carries the original cause.
 */
public class StoreException extends RuntimeException {
    private final DataCollection collection;
    private final boolean duplicateKey;

    public StoreException(String message, DataCollection collection, boolean duplicateKey, Throwable cause) {
        super(message, cause);
        this.collection = collection;
        this.duplicateKey = duplicateKey;
    }

    public StoreException(String message, DataCollection collection, Throwable cause) {
        this(message, collection, false, cause);
    }

    public DataCollection getCollection() {
        return collection;
    }

    /**
     * Whether the failure was a unique index rejecting the write.
     */
    public boolean isDuplicateKey() {
        return duplicateKey;
    }
}

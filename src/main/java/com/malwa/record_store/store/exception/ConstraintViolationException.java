package com.malwa.record_store.store.exception;

/**
 * Thrown when a write collides with an existing primary key or violates a unique index.
 */
public class ConstraintViolationException extends StoreException {

    private final String indexName;

    /**
     * @param indexName the violated unique index, or null when the primary key collided
     */
    public ConstraintViolationException(String collection, String key, String indexName, Throwable cause) {
        super(ErrorKind.CONSTRAINT_VIOLATION, collection, key, describe(collection, key, indexName), cause);
        this.indexName = indexName;
    }

    public String getIndexName() {
        return indexName;
    }

    public boolean isPrimaryKeyCollision() {
        return indexName == null;
    }

    private static String describe(String collection, String key, String indexName) {
        if (indexName == null) {
            return String.format("Duplicate primary key in %s: %s", collection, key);
        }
        return String.format("Unique index %s.%s violated by record %s", collection, indexName, key);
    }
}

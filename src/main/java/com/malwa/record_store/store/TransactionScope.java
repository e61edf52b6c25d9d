package com.malwa.record_store.store;

import java.util.Map;
import java.util.Set;

/**
 * The collections a running transaction may touch, handed to the transaction body.
 */
public class TransactionScope {

    private final String id;
    private final TxMode mode;
    private final Map<String, ScopedCollection> collections;

    TransactionScope(String id, TxMode mode, Map<String, ScopedCollection> collections) {
        this.id = id;
        this.mode = mode;
        this.collections = collections;
    }

    /**
     * Returns the handle for a collection named when the transaction was opened.
     *
     * @throws IllegalArgumentException if the collection is outside this transaction's scope
     */
    public ScopedCollection collection(String name) {
        ScopedCollection collection = collections.get(name);
        if (collection == null) {
            throw new IllegalArgumentException(String.format(
                "Collection %s is not part of transaction %s (scope: %s)", name, id, collections.keySet()));
        }
        return collection;
    }

    public String getId() {
        return id;
    }

    public TxMode getMode() {
        return mode;
    }

    public Set<String> getCollectionNames() {
        return collections.keySet();
    }
}

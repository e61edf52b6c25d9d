package com.malwa.record_store.store;

import com.malwa.record_store.schema.SchemaRegistry;
import com.malwa.record_store.store.exception.ConstraintViolationException;
import com.malwa.record_store.store.exception.RecordNotFoundException;
import com.malwa.record_store.store.exception.TransactionAbortedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Generic CRUD and query operations over any declared collection.
 *
 * This is the only persistence API the rest of the application uses. Every call runs
 * in its own transaction scoped to a single collection; workflows that must touch
 * several collections atomically use {@link TransactionCoordinator} directly.
 *
 * Records are open field maps. Primary keys are generated only for collections keyed
 * by {@code id}; key-value collections need the key supplied by the caller.
 */
@Service
@Slf4j
public class RecordStore {

    private final TransactionCoordinator coordinator;
    private final SchemaRegistry registry;
    private final RecordCodec codec;
    private final boolean debugOperations;

    public RecordStore(TransactionCoordinator coordinator,
                       SchemaRegistry registry,
                       RecordCodec codec,
                       @Value("${record-store.debug-operations:false}") boolean debugOperations) {
        this.coordinator = coordinator;
        this.registry = registry;
        this.codec = codec;
        this.debugOperations = debugOperations;
    }

    /**
     * Inserts a record, generating its key and timestamps when absent.
     *
     * @return the stored record including generated fields
     * @throws ConstraintViolationException if the key or a unique index value is taken
     */
    public Map<String, Object> insert(String collection, Map<String, Object> data) {
        Objects.requireNonNull(data, "data");
        Map<String, Object> stored = write(collection, scope -> scope.collection(collection).add(data));
        trace("insert", collection, keyOf(collection, stored));
        return stored;
    }

    /**
     * Merges {@code patch} over an existing record and refreshes {@code updated_at}.
     *
     * @throws RecordNotFoundException if no record has the given key
     */
    public Map<String, Object> update(String collection, String id, Map<String, Object> patch) {
        Objects.requireNonNull(patch, "patch");
        Map<String, Object> stored = write(collection, scope -> scope.collection(collection).update(id, patch));
        trace("update", collection, id);
        return stored;
    }

    /**
     * Removes a record. Deleting a key that does not exist succeeds.
     */
    public boolean delete(String collection, String id) {
        coordinator.runTransactionWithoutResult(List.of(collection), TxMode.READ_WRITE,
            scope -> scope.collection(collection).delete(id));
        trace("delete", collection, id);
        return true;
    }

    public Optional<Map<String, Object>> getById(String collection, String id) {
        if (id == null) {
            registry.collection(collection);
            return Optional.empty();
        }
        return read(collection, scope -> scope.collection(collection).get(id));
    }

    public List<Map<String, Object>> getAll(String collection) {
        return read(collection, scope -> scope.collection(collection).getAll());
    }

    /**
     * Full-scan equality filter. A record matches when every non-null filter value equals
     * the record's field; null filter values match everything.
     */
    public List<Map<String, Object>> query(String collection, Map<String, ?> filters) {
        List<Map<String, Object>> all = getAll(collection);
        if (filters == null || filters.isEmpty()) {
            return all;
        }
        return all.stream()
            .filter(record -> filters.entrySet().stream()
                .filter(filter -> filter.getValue() != null)
                .allMatch(filter -> codec.matches(record.get(filter.getKey()), filter.getValue())))
            .toList();
    }

    /**
     * Returns every record whose indexed field equals {@code value}.
     *
     * @throws IllegalArgumentException if the collection declares no such index, or
     *         {@code value} is not a string, number or boolean
     */
    public List<Map<String, Object>> getByIndex(String collection, String indexName, Object value) {
        registry.collection(collection).index(indexName);
        if (codec.indexKey(value) == null) {
            throw new IllegalArgumentException(String.format(
                "Value %s cannot be looked up through index %s.%s", value, collection, indexName));
        }
        return read(collection, scope -> scope.collection(collection).getByIndex(indexName, value));
    }

    public long count(String collection) {
        return read(collection, scope -> scope.collection(collection).count());
    }

    public void clear(String collection) {
        int removed = write(collection, scope -> scope.collection(collection).clear());
        log.info("Cleared collection {}: removed={}", collection, removed);
    }

    /**
     * Inserts or replaces many records in one transaction: either all land or none do.
     */
    public List<Map<String, Object>> bulkPut(String collection, Collection<? extends Map<String, Object>> records) {
        Objects.requireNonNull(records, "records");
        List<Map<String, Object>> stored = write(collection, scope -> {
            ScopedCollection target = scope.collection(collection);
            List<Map<String, Object>> written = new ArrayList<>(records.size());
            for (Map<String, Object> record : records) {
                written.add(target.put(record));
            }
            return written;
        });
        trace("bulkPut", collection, stored.size() + " records");
        return stored;
    }

    /**
     * Returns the requested records that exist, each exactly once.
     */
    public List<Map<String, Object>> bulkGet(String collection, Collection<String> ids) {
        Objects.requireNonNull(ids, "ids");
        return read(collection, scope -> {
            ScopedCollection source = scope.collection(collection);
            List<Map<String, Object>> found = new ArrayList<>();
            for (String id : new LinkedHashSet<>(ids)) {
                if (id != null) {
                    source.get(id).ifPresent(found::add);
                }
            }
            return found;
        });
    }

    private <T> T read(String collection, Function<TransactionScope, T> body) {
        return coordinator.runTransaction(List.of(collection), TxMode.READ_ONLY, body);
    }

    /**
     * @throws TransactionAbortedException if the engine rejected the write
     */
    private <T> T write(String collection, Function<TransactionScope, T> body) {
        return coordinator.runTransaction(List.of(collection), TxMode.READ_WRITE, body);
    }

    private String keyOf(String collection, Map<String, Object> record) {
        return RecordFields.string(record, registry.collection(collection).getPrimaryKey());
    }

    private void trace(String operation, String collection, String detail) {
        if (debugOperations) {
            log.debug("{} {}: {}", operation, collection, detail);
        }
    }
}

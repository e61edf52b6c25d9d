package com.malwa.record_store.store;

import com.malwa.record_store.schema.SchemaRegistry;
import com.malwa.record_store.store.exception.RecordNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A collection as seen from inside one transaction.
 *
 * Holds the record-level semantics shared by every caller: primary-key generation,
 * timestamp stamping, merge-patch updates and read-only enforcement. Every returned
 * record is in the form it reads back from storage.
 */
public class ScopedCollection {

    private final CollectionTable table;
    private final TxMode mode;
    private final RecordCodec codec;
    private final Clock clock;

    ScopedCollection(CollectionTable table, TxMode mode, RecordCodec codec, Clock clock) {
        this.table = table;
        this.mode = mode;
        this.codec = codec;
        this.clock = clock;
    }

    public String getName() {
        return table.getName();
    }

    public Optional<Map<String, Object>> get(String key) {
        return table.find(key, false);
    }

    /**
     * Reads a record and locks it until the transaction ends, so that concurrent
     * read-modify-write cycles on the same record are serialized.
     */
    public Optional<Map<String, Object>> getForUpdate(String key) {
        requireWritable("lock");
        return table.find(key, true);
    }

    public List<Map<String, Object>> getAll() {
        return table.findAll();
    }

    public List<Map<String, Object>> getByIndex(String indexName, Object value) {
        return table.findByIndex(table.getSchema().index(indexName), value);
    }

    public long count() {
        return table.count();
    }

    /**
     * Inserts a new record, generating an {@code id} and timestamps when absent.
     */
    public Map<String, Object> add(Map<String, Object> data) {
        requireWritable("insert into");
        Map<String, Object> record = new LinkedHashMap<>(data);
        String primaryKey = table.getSchema().getPrimaryKey();
        if (isAbsent(record.get(primaryKey)) && SchemaRegistry.ID.equals(primaryKey)) {
            record.put(primaryKey, UUID.randomUUID().toString());
        }
        String now = now();
        stampIfAbsent(record, RecordFields.CREATED_AT, now);
        stampIfAbsent(record, RecordFields.UPDATED_AT, now);
        table.insert(record);
        return codec.normalize(record);
    }

    /**
     * Inserts or replaces a record by primary key; timestamps are stamped only when absent.
     */
    public Map<String, Object> put(Map<String, Object> data) {
        requireWritable("write to");
        Map<String, Object> record = new LinkedHashMap<>(data);
        String now = now();
        stampIfAbsent(record, RecordFields.CREATED_AT, now);
        stampIfAbsent(record, RecordFields.UPDATED_AT, now);
        table.upsert(record);
        return codec.normalize(record);
    }

    /**
     * Merges {@code patch} over the stored record. The primary key is never overwritten
     * and {@code updated_at} is always refreshed.
     *
     * @throws RecordNotFoundException if no record has the given key
     */
    public Map<String, Object> update(String key, Map<String, Object> patch) {
        requireWritable("update");
        Map<String, Object> existing = table.find(key, true)
            .orElseThrow(() -> new RecordNotFoundException(table.getName(), key));
        String primaryKey = table.getSchema().getPrimaryKey();
        Map<String, Object> merged = new LinkedHashMap<>(existing);
        merged.putAll(patch);
        merged.put(primaryKey, existing.get(primaryKey));
        merged.put(RecordFields.UPDATED_AT, now());
        table.upsert(merged);
        return codec.normalize(merged);
    }

    public void delete(String key) {
        requireWritable("delete from");
        table.delete(key);
    }

    public int clear() {
        requireWritable("clear");
        return table.deleteAll();
    }

    private void requireWritable(String action) {
        if (mode != TxMode.READ_WRITE) {
            throw new IllegalStateException(String.format(
                "Cannot %s collection %s in a read-only transaction", action, table.getName()));
        }
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private static void stampIfAbsent(Map<String, Object> record, String field, String value) {
        if (isAbsent(record.get(field))) {
            record.put(field, value);
        }
    }

    private static boolean isAbsent(Object value) {
        return value == null || (value instanceof String text && text.isBlank());
    }
}

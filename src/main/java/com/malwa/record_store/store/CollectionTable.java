package com.malwa.record_store.store;

import com.malwa.record_store.schema.CollectionSchema;
import com.malwa.record_store.schema.IndexDefinition;
import com.malwa.record_store.store.exception.ConstraintViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.malwa.record_store.store.StoreTables.DOCUMENT_COLUMN;
import static com.malwa.record_store.store.StoreTables.KEY_COLUMN;
import static com.malwa.record_store.store.StoreTables.indexColumn;
import static com.malwa.record_store.store.StoreTables.quote;

/**
 * SQL access to one collection's table.
 *
 * Runs inside whatever transaction is bound to the current thread; it never opens or
 * commits one itself. Duplicate-key failures are classified here, where the collection
 * and key are still known.
 */
public class CollectionTable {

    private final CollectionSchema schema;
    private final JdbcTemplate jdbcTemplate;
    private final RecordCodec codec;

    private final String table;
    private final String columnList;
    private final String placeholders;

    public CollectionTable(CollectionSchema schema, JdbcTemplate jdbcTemplate, RecordCodec codec) {
        this.schema = schema;
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.table = StoreTables.table(schema);

        List<String> columns = new ArrayList<>();
        columns.add(quote(KEY_COLUMN));
        columns.add(quote(DOCUMENT_COLUMN));
        schema.getIndexes().forEach(index -> columns.add(quote(indexColumn(index))));
        this.columnList = String.join(", ", columns);
        this.placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
    }

    public CollectionSchema getSchema() {
        return schema;
    }

    public String getName() {
        return schema.getName();
    }

    public Optional<Map<String, Object>> find(String key, boolean forUpdate) {
        String sql = "SELECT " + quote(DOCUMENT_COLUMN) + " FROM " + table
            + " WHERE " + quote(KEY_COLUMN) + " = ?" + (forUpdate ? " FOR UPDATE" : "");
        return jdbcTemplate.queryForList(sql, String.class, key).stream()
            .findFirst()
            .map(codec::read);
    }

    public List<Map<String, Object>> findAll() {
        String sql = "SELECT " + quote(DOCUMENT_COLUMN) + " FROM " + table
            + " ORDER BY " + quote(KEY_COLUMN);
        return readAll(jdbcTemplate.queryForList(sql, String.class));
    }

    public List<Map<String, Object>> findByIndex(IndexDefinition index, Object value) {
        String indexKey = codec.indexKey(value);
        if (indexKey == null) {
            throw new IllegalArgumentException(String.format(
                "Value %s cannot be looked up through index %s.%s", value, schema.getName(), index.getName()));
        }
        String sql = "SELECT " + quote(DOCUMENT_COLUMN) + " FROM " + table
            + " WHERE " + quote(indexColumn(index)) + " = ? ORDER BY " + quote(KEY_COLUMN);
        return readAll(jdbcTemplate.queryForList(sql, String.class, indexKey));
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Writes a new record; fails if the primary key or a unique index value is taken.
     */
    public void insert(Map<String, Object> record) {
        write("INSERT INTO " + table + " (" + columnList + ") VALUES (" + placeholders + ")", record);
    }

    /**
     * Writes a record, replacing any record with the same primary key.
     */
    public void upsert(Map<String, Object> record) {
        write("MERGE INTO " + table + " (" + columnList + ") KEY (" + quote(KEY_COLUMN) + ") VALUES ("
            + placeholders + ")", record);
    }

    public void delete(String key) {
        jdbcTemplate.update("DELETE FROM " + table + " WHERE " + quote(KEY_COLUMN) + " = ?", key);
    }

    public int deleteAll() {
        return jdbcTemplate.update("DELETE FROM " + table);
    }

    public String keyOf(Map<String, Object> record) {
        Object key = record.get(schema.getPrimaryKey());
        if (key == null || key.toString().isBlank()) {
            throw new IllegalArgumentException(String.format(
                "Record for collection %s has no %s", schema.getName(), schema.getPrimaryKey()));
        }
        return key.toString();
    }

    private void write(String sql, Map<String, Object> record) {
        String key = keyOf(record);
        Object[] args = new Object[2 + schema.getIndexes().size()];
        args[0] = key;
        args[1] = codec.write(record);
        int i = 2;
        for (IndexDefinition index : schema.getIndexes()) {
            args[i++] = codec.indexKey(record.get(index.getField()));
        }
        try {
            jdbcTemplate.update(sql, args);
        } catch (DuplicateKeyException e) {
            throw new ConstraintViolationException(schema.getName(), key, violatedIndex(e), e);
        }
    }

    private String violatedIndex(DuplicateKeyException e) {
        String message = String.valueOf(e.getMostSpecificCause().getMessage());
        return schema.getIndexes().stream()
            .filter(IndexDefinition::isUnique)
            .filter(index -> message.contains(StoreTables.indexName(schema, index)))
            .max(Comparator.comparingInt(index -> index.getName().length()))
            .map(IndexDefinition::getName)
            .orElse(null);
    }

    private List<Map<String, Object>> readAll(List<String> documents) {
        return documents.stream().map(codec::read).toList();
    }
}

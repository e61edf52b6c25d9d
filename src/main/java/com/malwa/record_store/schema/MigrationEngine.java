package com.malwa.record_store.schema;

import com.malwa.record_store.observability.StoreMetrics;
import com.malwa.record_store.store.RecordCodec;
import com.malwa.record_store.store.StoreTables;
import com.malwa.record_store.store.exception.MigrationFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.malwa.record_store.store.StoreTables.DOCUMENT_COLUMN;
import static com.malwa.record_store.store.StoreTables.KEY_COLUMN;
import static com.malwa.record_store.store.StoreTables.VERSION_TABLE;
import static com.malwa.record_store.store.StoreTables.indexColumn;
import static com.malwa.record_store.store.StoreTables.quote;

/**
 * Brings the physical store up to a schema version.
 *
 * Every step is idempotent (DDL in the embedded database commits on its own), and the
 * stored version is written only after all steps succeeded. A failed run therefore
 * leaves the previous version in place and can simply be retried.
 *
 * New indexes on existing collections are backfilled from the stored documents before
 * the index is created, so a unique index over duplicate data fails the migration
 * instead of silently skipping records.
 */
@Component
@Slf4j
public class MigrationEngine {

    private static final int VERSION_ROW = 1;

    private final JdbcTemplate jdbcTemplate;
    private final SchemaRegistry registry;
    private final RecordCodec codec;
    private final StoreMetrics metrics;

    public MigrationEngine(JdbcTemplate jdbcTemplate, SchemaRegistry registry,
                           RecordCodec codec, StoreMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.registry = registry;
        this.codec = codec;
        this.metrics = metrics;
    }

    /**
     * Opens the store at the registry's current version.
     */
    public int open() {
        return open(registry.getVersion());
    }

    /**
     * Creates missing collections and indexes up to {@code targetVersion} and records it.
     *
     * @return the version the store is now at
     * @throws IllegalArgumentException if the target is outside 1..registry version
     * @throws MigrationFailureException if the store is newer than the target or a step failed
     */
    public int open(int targetVersion) {
        if (targetVersion < 1 || targetVersion > registry.getVersion()) {
            throw new IllegalArgumentException(String.format(
                "Target version %d outside 1..%d", targetVersion, registry.getVersion()));
        }

        int storedVersion;
        try {
            storedVersion = currentVersion();
        } catch (RuntimeException e) {
            throw new MigrationFailureException(null, 0, targetVersion, "cannot read schema version", e);
        }

        if (storedVersion > targetVersion) {
            throw new MigrationFailureException(null, storedVersion, targetVersion,
                "store was written by a newer schema", null);
        }
        if (storedVersion == targetVersion) {
            log.debug("Store already at schema version {}", storedVersion);
            return storedVersion;
        }

        log.info("Migrating store: fromVersion={}, toVersion={}", storedVersion, targetVersion);
        long start = System.nanoTime();
        String current = null;
        try {
            for (CollectionSchema collection : registry.getCollections()) {
                if (collection.getSinceVersion() > targetVersion) {
                    continue;
                }
                current = collection.getName();
                migrateCollection(collection, storedVersion, targetVersion);
            }
            current = null;
            writeVersion(targetVersion);

        } catch (RuntimeException e) {
            metrics.recordMigration(storedVersion, targetVersion, false, Duration.ofNanos(System.nanoTime() - start));
            log.error("Migration failed: fromVersion={}, toVersion={}, collection={}, error={}",
                storedVersion, targetVersion, current, e.getMessage());
            throw new MigrationFailureException(current, storedVersion, targetVersion, e.getMessage(), e);
        }

        metrics.recordMigration(storedVersion, targetVersion, true, Duration.ofNanos(System.nanoTime() - start));
        log.info("Store migrated to schema version {}", targetVersion);
        return targetVersion;
    }

    /**
     * The schema version recorded in the store, or 0 for a store that was never opened.
     */
    public int currentVersion() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + VERSION_TABLE
            + " (\"id\" INT PRIMARY KEY, \"version\" INT NOT NULL)");
        List<Integer> versions = jdbcTemplate.queryForList(
            "SELECT \"version\" FROM " + VERSION_TABLE + " WHERE \"id\" = ?", Integer.class, VERSION_ROW);
        return versions.isEmpty() ? 0 : versions.get(0);
    }

    private void migrateCollection(CollectionSchema collection, int storedVersion, int targetVersion) {
        String table = StoreTables.table(collection);
        boolean newCollection = collection.getSinceVersion() > storedVersion;
        if (newCollection) {
            log.debug("Creating collection {}", collection.getName());
        }
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
            + quote(KEY_COLUMN) + " VARCHAR(512) PRIMARY KEY, "
            + quote(DOCUMENT_COLUMN) + " CLOB NOT NULL)");

        for (IndexDefinition index : collection.indexesAt(targetVersion)) {
            if (newCollection || index.getSinceVersion() > storedVersion) {
                addIndex(collection, index);
            }
        }
    }

    private void addIndex(CollectionSchema collection, IndexDefinition index) {
        String table = StoreTables.table(collection);
        String column = quote(indexColumn(index));

        jdbcTemplate.execute("ALTER TABLE " + table + " ADD COLUMN IF NOT EXISTS " + column + " VARCHAR");
        int backfilled = backfill(collection, index);

        jdbcTemplate.execute("CREATE " + (index.isUnique() ? "UNIQUE " : "") + "INDEX IF NOT EXISTS "
            + quote(StoreTables.indexName(collection, index)) + " ON " + table + " (" + column + ")");

        log.debug("Index {}.{} ready: unique={}, backfilled={}",
            collection.getName(), index.getName(), index.isUnique(), backfilled);
    }

    private int backfill(CollectionSchema collection, IndexDefinition index) {
        String table = StoreTables.table(collection);
        List<Object[]> updates = new ArrayList<>();
        jdbcTemplate.query("SELECT " + quote(KEY_COLUMN) + ", " + quote(DOCUMENT_COLUMN) + " FROM " + table,
            (RowCallbackHandler) rs -> {
                Object value = codec.read(rs.getString(2)).get(index.getField());
                updates.add(new Object[]{codec.indexKey(value), rs.getString(1)});
            });
        if (!updates.isEmpty()) {
            jdbcTemplate.batchUpdate("UPDATE " + table + " SET " + quote(indexColumn(index)) + " = ? WHERE "
                + quote(KEY_COLUMN) + " = ?", updates);
        }
        return updates.size();
    }

    private void writeVersion(int version) {
        jdbcTemplate.update("MERGE INTO " + VERSION_TABLE + " (\"id\", \"version\") KEY (\"id\") VALUES (?, ?)",
            VERSION_ROW, version);
    }
}

package com.malwa.record_store.store;

import com.malwa.record_store.schema.CollectionSchema;
import com.malwa.record_store.schema.IndexDefinition;

/**
 * Physical layout of collections in the embedded database.
 *
 * Each collection is one table holding the primary key, the JSON document and one
 * column per declared index. Identifiers are quoted so that mixed-case field names
 * survive unchanged; the schema registry only admits plain identifier characters.
 */
public final class StoreTables {

    public static final String VERSION_TABLE = "\"_schema_version\"";
    public static final String KEY_COLUMN = "record_key";
    public static final String DOCUMENT_COLUMN = "document";

    private StoreTables() {
    }

    public static String quote(String identifier) {
        return "\"" + identifier + "\"";
    }

    public static String table(CollectionSchema schema) {
        return quote(schema.getName());
    }

    public static String indexColumn(IndexDefinition index) {
        return "idx_" + index.getName();
    }

    public static String indexName(CollectionSchema schema, IndexDefinition index) {
        return schema.getName() + "__" + index.getName();
    }
}

package com.malwa.record_store.schema;

import lombok.Value;

/**
 * A secondary index over one top-level record field.
 *
 * {@code sinceVersion} is the schema version that introduced the index; the migration
 * engine adds it to an existing collection only when upgrading across that version.
 */
@Value
public class IndexDefinition {
    String name;
    String field;
    boolean unique;
    int sinceVersion;

    public static IndexDefinition of(String field) {
        return new IndexDefinition(field, field, false, 1);
    }

    public static IndexDefinition unique(String field) {
        return new IndexDefinition(field, field, true, 1);
    }

    public IndexDefinition since(int version) {
        return new IndexDefinition(name, field, unique, version);
    }
}

package com.malwa.record_store.schema;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Declared shape of one collection: its primary-key field and its secondary indexes.
 */
@Value
public class CollectionSchema {
    String name;
    String primaryKey;
    List<IndexDefinition> indexes;
    int sinceVersion;

    public Optional<IndexDefinition> findIndex(String indexName) {
        return indexes.stream()
            .filter(index -> index.getName().equals(indexName))
            .findFirst();
    }

    public IndexDefinition index(String indexName) {
        return findIndex(indexName)
            .orElseThrow(() -> new IllegalArgumentException(
                String.format("Index %s is not declared on collection %s", indexName, name)));
    }

    /**
     * Indexes that exist in a store at the given schema version.
     */
    public List<IndexDefinition> indexesAt(int version) {
        return indexes.stream()
            .filter(index -> index.getSinceVersion() <= version)
            .toList();
    }
}

package com.malwa.record_store.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Versioned, immutable table of every collection the store knows about.
 *
 * Built once at startup through {@link #builder(int)}; the migration engine walks it to
 * bring the physical store up to {@link #getVersion()}.
 */
public final class SchemaRegistry {

    public static final String ID = "id";
    public static final String KEY = "key";

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    private final int version;
    private final Map<String, CollectionSchema> collections;

    private SchemaRegistry(int version, Map<String, CollectionSchema> collections) {
        this.version = version;
        this.collections = collections;
    }

    public static Builder builder(int version) {
        return new Builder(version);
    }

    public int getVersion() {
        return version;
    }

    public Collection<CollectionSchema> getCollections() {
        return collections.values();
    }

    public Optional<CollectionSchema> find(String collection) {
        return Optional.ofNullable(collections.get(collection));
    }

    public CollectionSchema collection(String collection) {
        CollectionSchema schema = collections.get(collection);
        if (schema == null) {
            throw new IllegalArgumentException("Unknown collection: " + collection);
        }
        return schema;
    }

    public boolean contains(String collection) {
        return collections.containsKey(collection);
    }

    public static final class Builder {

        private final int version;
        private final Map<String, CollectionSchema> collections = new LinkedHashMap<>();

        private Builder(int version) {
            if (version < 1) {
                throw new IllegalArgumentException("Schema version must be at least 1");
            }
            this.version = version;
        }

        public Builder collection(String name, IndexDefinition... indexes) {
            return add(name, ID, 1, indexes);
        }

        public Builder keyValueCollection(String name) {
            return add(name, KEY, 1);
        }

        public Builder collectionSince(int sinceVersion, String name, IndexDefinition... indexes) {
            return add(name, ID, sinceVersion, indexes);
        }

        public Builder add(String name, String primaryKey, int sinceVersion, IndexDefinition... indexes) {
            requireName(name, "collection");
            requireName(primaryKey, "primary key");
            if (collections.containsKey(name)) {
                throw new IllegalArgumentException("Collection declared twice: " + name);
            }
            if (sinceVersion < 1 || sinceVersion > version) {
                throw new IllegalArgumentException(String.format(
                    "Collection %s introduced at version %d outside 1..%d", name, sinceVersion, version));
            }
            List<IndexDefinition> declared = new ArrayList<>();
            for (IndexDefinition index : indexes) {
                requireName(index.getName(), "index");
                requireName(index.getField(), "index field");
                int since = Math.max(index.getSinceVersion(), sinceVersion);
                if (since > version) {
                    throw new IllegalArgumentException(String.format(
                        "Index %s.%s introduced at version %d beyond %d", name, index.getName(), since, version));
                }
                if (declared.stream().anyMatch(d -> d.getName().equals(index.getName()))) {
                    throw new IllegalArgumentException(
                        String.format("Index declared twice: %s.%s", name, index.getName()));
                }
                declared.add(new IndexDefinition(index.getName(), index.getField(), index.isUnique(), since));
            }
            collections.put(name, new CollectionSchema(name, primaryKey, List.copyOf(declared), sinceVersion));
            return this;
        }

        public SchemaRegistry build() {
            return new SchemaRegistry(version, Collections.unmodifiableMap(new LinkedHashMap<>(collections)));
        }

        private static void requireName(String value, String what) {
            if (value == null || !NAME_PATTERN.matcher(value).matches()) {
                throw new IllegalArgumentException(String.format("Invalid %s name: %s", what, value));
            }
        }
    }
}

package com.malwa.record_store.observability;

import com.malwa.record_store.schema.SchemaRegistry;
import com.malwa.record_store.store.StoreHandle;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * Reports whether the record store is open and at which schema version.
 * A store that has not been used yet is reported as UNKNOWN rather than opened here.
 */
@Component("recordStoreHealth")
public class StoreHealthIndicator implements HealthIndicator {

    private final StoreHandle storeHandle;
    private final SchemaRegistry registry;

    public StoreHealthIndicator(StoreHandle storeHandle, SchemaRegistry registry) {
        this.storeHandle = storeHandle;
        this.registry = registry;
    }

    @Override
    public Health health() {
        OptionalInt version = storeHandle.getOpenVersion();
        if (version.isEmpty()) {
            return Health.unknown()
                    .withDetail("open", false)
                    .withDetail("targetVersion", registry.getVersion())
                    .build();
        }

        Health.Builder builder = version.getAsInt() == registry.getVersion() ? Health.up() : Health.down();
        return builder
                .withDetail("open", true)
                .withDetail("schemaVersion", version.getAsInt())
                .withDetail("targetVersion", registry.getVersion())
                .withDetail("collections", registry.getCollections().size())
                .build();
    }
}

package com.malwa.record_store.store;

import com.malwa.record_store.schema.MigrationEngine;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * Owns the lifecycle of the opened store.
 *
 * The store is opened (and migrated) exactly once, on first use or at startup when
 * {@code record-store.open-on-startup} is set. Concurrent first callers wait for the
 * single open to finish. A failed open is not remembered, so the next call retries it.
 */
@Component
@Slf4j
public class StoreHandle {

    private final MigrationEngine migrationEngine;
    private final boolean openOnStartup;

    private final Object lock = new Object();
    private volatile Integer openVersion;
    private volatile boolean shutDown;

    public StoreHandle(MigrationEngine migrationEngine,
                       @Value("${record-store.open-on-startup:false}") boolean openOnStartup) {
        this.migrationEngine = migrationEngine;
        this.openOnStartup = openOnStartup;
    }

    /**
     * Returns the schema version of the opened store, opening it first if needed.
     *
     * @throws IllegalStateException if the store has been shut down
     */
    public int ensureOpen() {
        Integer version = openVersion;
        if (version != null && !shutDown) {
            return version;
        }
        synchronized (lock) {
            if (shutDown) {
                throw new IllegalStateException("Record store has been shut down");
            }
            if (openVersion == null) {
                openVersion = migrationEngine.open();
                log.info("Record store opened at schema version {}", openVersion);
            }
            return openVersion;
        }
    }

    public boolean isOpen() {
        return openVersion != null && !shutDown;
    }

    public OptionalInt getOpenVersion() {
        Integer version = openVersion;
        return version != null && !shutDown ? OptionalInt.of(version) : OptionalInt.empty();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void openOnStartup() {
        if (openOnStartup) {
            ensureOpen();
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            shutDown = true;
            if (openVersion != null) {
                log.info("Record store closed");
            }
        }
    }
}

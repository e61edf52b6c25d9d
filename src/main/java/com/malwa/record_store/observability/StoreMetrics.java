package com.malwa.record_store.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the record store.
 *
 * Metrics exposed:
 * - store.transactions: Counter of finished transactions, tagged by mode and outcome
 * - store.transaction.duration: Timer for transaction bodies including commit
 * - store.sequence.issued: Counter of sequence values handed out, tagged by prefix
 * - store.balance.recalculated: Counter of ledger balance recalculations, tagged by entity type
 * - store.stock.movements: Counter of stock movements, tagged by movement type
 * - store.migrations: Counter of schema migrations, tagged by versions and outcome
 * - store.migration.duration: Timer for migration runs
 */
@Component
public class StoreMetrics {

    private final MeterRegistry registry;

    private final Timer migrationTimer;

    public StoreMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.migrationTimer = Timer.builder("store.migration.duration")
                .description("Time taken to bring the store to the current schema version")
                .register(registry);
    }

    // ==================== Transactions ====================

    public void recordTransaction(String mode, String outcome, Duration duration) {
        registry.counter("store.transactions",
                "mode", sanitizeTag(mode),
                "outcome", sanitizeTag(outcome)
        ).increment();

        registry.timer("store.transaction.duration",
                "mode", sanitizeTag(mode),
                "outcome", sanitizeTag(outcome)
        ).record(duration);
    }

    // ==================== Domain Operations ====================

    public void recordSequenceIssued(String prefix) {
        registry.counter("store.sequence.issued", "prefix", sanitizeTag(prefix)).increment();
    }

    public void recordBalanceRecalculated(String entityType) {
        registry.counter("store.balance.recalculated", "entity_type", sanitizeTag(entityType)).increment();
    }

    public void recordStockMovement(String movementType) {
        registry.counter("store.stock.movements", "type", sanitizeTag(movementType)).increment();
    }

    // ==================== Migrations ====================

    public void recordMigration(int fromVersion, int toVersion, boolean success, Duration duration) {
        Counter.builder("store.migrations")
                .tag("from", String.valueOf(fromVersion))
                .tag("to", String.valueOf(toVersion))
                .tag("outcome", success ? "applied" : "failed")
                .register(registry)
                .increment();
        migrationTimer.record(duration);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

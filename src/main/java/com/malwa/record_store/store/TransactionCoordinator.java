package com.malwa.record_store.store;

import com.malwa.record_store.observability.StoreMetrics;
import com.malwa.record_store.schema.SchemaRegistry;
import com.malwa.record_store.store.exception.StoreException;
import com.malwa.record_store.store.exception.TransactionAbortedException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs all-or-nothing units of work over a named set of collections.
 *
 * Ordering between overlapping read-write transactions is left to the database's row
 * locks; this class adds the scope contract and turns every failure into a
 * {@link StoreException}. A body that throws rolls back every write it issued.
 *
 * Transactions opened while another is active on the same thread join it, and stay
 * inside its scope: a joining call may only name collections of the outer transaction
 * and may only write when the outer transaction is read-write.
 */
@Component
@Slf4j
public class TransactionCoordinator {

    public static final String TX_MDC_KEY = "txId";

    private final SchemaRegistry registry;
    private final JdbcTemplate jdbcTemplate;
    private final RecordCodec codec;
    private final StoreHandle storeHandle;
    private final StoreMetrics metrics;
    private final Clock clock;

    private final TransactionTemplate readWriteTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final Map<String, CollectionTable> tables = new ConcurrentHashMap<>();
    private final ThreadLocal<TransactionScope> activeScope = new ThreadLocal<>();

    public TransactionCoordinator(SchemaRegistry registry,
                                  JdbcTemplate jdbcTemplate,
                                  RecordCodec codec,
                                  StoreHandle storeHandle,
                                  StoreMetrics metrics,
                                  Clock clock,
                                  PlatformTransactionManager transactionManager) {
        this.registry = registry;
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.storeHandle = storeHandle;
        this.metrics = metrics;
        this.clock = clock;

        this.readWriteTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
    }

    /**
     * Runs {@code body} in one transaction over exactly the named collections.
     *
     * @param collectionNames collections the body may touch; must be declared in the schema
     * @param mode read-only or read-write
     * @param body the unit of work
     * @return the body's result, once every write has been committed
     * @throws IllegalArgumentException if no collection or an unknown collection is named
     * @throws IllegalStateException if a joining call reaches outside the outer transaction's scope
     * @throws StoreException if the transaction was rolled back
     */
    public <T> T runTransaction(Collection<String> collectionNames, TxMode mode,
                                Function<TransactionScope, T> body) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(body, "body");
        List<String> names = validate(collectionNames);

        TransactionScope outer = activeScope.get();
        if (outer != null) {
            requireWithin(outer, names, mode);
        }

        storeHandle.ensureOpen();

        boolean outermost = outer == null;
        String txId = outermost ? UUID.randomUUID().toString().substring(0, 8) : outer.getId();
        if (outermost) {
            MDC.put(TX_MDC_KEY, txId);
        }
        long start = System.nanoTime();

        try {
            TransactionTemplate template = mode == TxMode.READ_ONLY ? readOnlyTemplate : readWriteTemplate;
            T result = template.execute(status -> {
                TransactionScope scope = scope(txId, names, mode);
                if (outermost) {
                    activeScope.set(scope);
                }
                return body.apply(scope);
            });
            metrics.recordTransaction(mode.name(), "committed", Duration.ofNanos(System.nanoTime() - start));
            log.debug("Transaction committed: mode={}, collections={}", mode, names);
            return result;

        } catch (StoreException e) {
            metrics.recordTransaction(mode.name(), "aborted", Duration.ofNanos(System.nanoTime() - start));
            log.warn("Transaction aborted: collections={}, kind={}, error={}", names, e.getKind(), e.getMessage());
            throw e;

        } catch (RuntimeException e) {
            metrics.recordTransaction(mode.name(), "aborted", Duration.ofNanos(System.nanoTime() - start));
            log.warn("Transaction aborted: collections={}, error={}", names, e.getMessage());
            throw TransactionAbortedException.of(names, e);

        } finally {
            if (outermost) {
                activeScope.remove();
                MDC.remove(TX_MDC_KEY);
            }
        }
    }

    /**
     * Variant of {@link #runTransaction(Collection, TxMode, Function)} for bodies without a result.
     */
    public void runTransactionWithoutResult(Collection<String> collectionNames, TxMode mode,
                                            Consumer<TransactionScope> body) {
        Objects.requireNonNull(body, "body");
        runTransaction(collectionNames, mode, scope -> {
            body.accept(scope);
            return null;
        });
    }

    private static void requireWithin(TransactionScope outer, List<String> names, TxMode mode) {
        if (mode == TxMode.READ_WRITE && outer.getMode() == TxMode.READ_ONLY) {
            throw new IllegalStateException(String.format(
                "Cannot open a read-write transaction on %s inside read-only transaction %s", names, outer.getId()));
        }
        List<String> outside = names.stream()
            .filter(name -> !outer.getCollectionNames().contains(name))
            .toList();
        if (!outside.isEmpty()) {
            throw new IllegalStateException(String.format(
                "Collections %s are not part of transaction %s (scope: %s)",
                outside, outer.getId(), outer.getCollectionNames()));
        }
    }

    private TransactionScope scope(String txId, List<String> names, TxMode mode) {
        Map<String, ScopedCollection> collections = new LinkedHashMap<>();
        for (String name : names) {
            collections.put(name, new ScopedCollection(table(name), mode, codec, clock));
        }
        return new TransactionScope(txId, mode, collections);
    }

    private CollectionTable table(String name) {
        return tables.computeIfAbsent(name,
            n -> new CollectionTable(registry.collection(n), jdbcTemplate, codec));
    }

    private List<String> validate(Collection<String> collectionNames) {
        if (collectionNames == null || collectionNames.isEmpty()) {
            throw new IllegalArgumentException("A transaction must name at least one collection");
        }
        Set<String> distinct = new LinkedHashSet<>(collectionNames);
        for (String name : distinct) {
            registry.collection(name);
        }
        return List.copyOf(distinct);
    }
}

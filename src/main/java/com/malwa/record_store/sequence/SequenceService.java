package com.malwa.record_store.sequence;

import com.malwa.record_store.observability.StoreMetrics;
import com.malwa.record_store.schema.ErpSchema;
import com.malwa.record_store.schema.SchemaRegistry;
import com.malwa.record_store.store.RecordFields;
import com.malwa.record_store.store.ScopedCollection;
import com.malwa.record_store.store.TransactionCoordinator;
import com.malwa.record_store.store.TxMode;
import com.malwa.record_store.store.exception.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-prefix counters used to mint display codes such as invoice numbers.
 *
 * Each value is issued by a read-increment-write on the prefix's counter row, locked
 * for the duration of a read-write transaction over {@code sequences} only. Concurrent
 * callers for the same prefix queue on the row lock, so no value is issued twice and,
 * because a rolled-back transaction issues nothing, none is skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SequenceService {

    public static final int DEFAULT_WIDTH = 3;

    static final String VALUE = "value";

    private static final List<String> SCOPE = List.of(ErpSchema.SEQUENCES);

    private final TransactionCoordinator coordinator;
    private final StoreMetrics metrics;

    /**
     * Issues the next value for {@code prefix}, starting at 1.
     *
     * @throws IllegalArgumentException if the prefix is null or blank
     */
    public long nextSequence(String prefix) {
        requirePrefix(prefix);
        ensureCounter(prefix);

        long next = coordinator.runTransaction(SCOPE, TxMode.READ_WRITE, scope -> {
            ScopedCollection sequences = scope.collection(ErpSchema.SEQUENCES);
            Map<String, Object> counter = sequences.getForUpdate(prefix)
                .orElseThrow(() -> new IllegalStateException("Sequence counter vanished: " + prefix));
            long value = RecordFields.decimal(counter, VALUE).longValueExact() + 1;

            Map<String, Object> updated = new LinkedHashMap<>(counter);
            updated.put(VALUE, value);
            updated.remove(RecordFields.UPDATED_AT);
            sequences.put(updated);
            return value;
        });

        metrics.recordSequenceIssued(prefix);
        log.debug("Sequence issued: prefix={}, value={}", prefix, next);
        return next;
    }

    /**
     * Issues the next value and formats it as {@code PREFIX-007} with at least three digits.
     */
    public String generateCode(String prefix) {
        return generateCode(prefix, DEFAULT_WIDTH);
    }

    /**
     * Issues the next value and formats it as {@code PREFIX-number}, zero-padded to
     * {@code width} digits. Wider numbers are kept whole.
     */
    public String generateCode(String prefix, int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Code width must be at least 1, got " + width);
        }
        long value = nextSequence(prefix);
        return String.format("%s-%0" + width + "d", prefix, value);
    }

    /**
     * Returns the last value issued for {@code prefix}, or 0 if none was, without issuing one.
     */
    public long currentValue(String prefix) {
        requirePrefix(prefix);
        return coordinator.runTransaction(SCOPE, TxMode.READ_ONLY, scope ->
            scope.collection(ErpSchema.SEQUENCES).get(prefix)
                .map(counter -> RecordFields.decimal(counter, VALUE).longValueExact())
                .orElse(0L));
    }

    /**
     * Makes sure the counter row exists so that the issuing transaction can lock it.
     * Losing the race to a concurrent creator is fine: the row exists either way.
     */
    private void ensureCounter(String prefix) {
        try {
            coordinator.runTransactionWithoutResult(SCOPE, TxMode.READ_WRITE, scope -> {
                ScopedCollection sequences = scope.collection(ErpSchema.SEQUENCES);
                if (sequences.get(prefix).isEmpty()) {
                    Map<String, Object> counter = new LinkedHashMap<>();
                    counter.put(SchemaRegistry.KEY, prefix);
                    counter.put(VALUE, 0L);
                    sequences.add(counter);
                    log.info("Sequence created: prefix={}", prefix);
                }
            });
        } catch (ConstraintViolationException e) {
            log.debug("Sequence {} created concurrently", prefix);
        }
    }

    private static void requirePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Sequence prefix cannot be null or blank");
        }
    }
}

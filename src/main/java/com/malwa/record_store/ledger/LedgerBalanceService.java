package com.malwa.record_store.ledger;

import com.malwa.record_store.observability.StoreMetrics;
import com.malwa.record_store.store.RecordFields;
import com.malwa.record_store.store.ScopedCollection;
import com.malwa.record_store.store.TransactionCoordinator;
import com.malwa.record_store.store.TransactionScope;
import com.malwa.record_store.store.TxMode;
import com.malwa.record_store.store.exception.RecordNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.malwa.record_store.ledger.LedgerFields.CREDIT;
import static com.malwa.record_store.ledger.LedgerFields.CURRENT_BALANCE;
import static com.malwa.record_store.ledger.LedgerFields.DEBIT;
import static com.malwa.record_store.ledger.LedgerFields.ENTRY_DATE;
import static com.malwa.record_store.ledger.LedgerFields.OPENING_BALANCE;
import static com.malwa.record_store.ledger.LedgerFields.PARTICULARS;
import static com.malwa.record_store.ledger.LedgerFields.REF_ID;
import static com.malwa.record_store.ledger.LedgerFields.REF_TYPE;

/**
 * Derives and maintains the running balance of customers, vendors, labour and suppliers.
 *
 * Balances are never updated incrementally. Every recalculation recomputes
 * {@code current_balance = opening_balance + sum(debit - credit)} from the full entry
 * history, so running it again is harmless and it repairs any earlier missed update.
 *
 * Callers that write ledger entries through the generic CRUD API must call
 * {@link #recalculateBalance(LedgerType, String)} afterwards; {@link #postEntry} does both
 * in one transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerBalanceService {

    private static final Comparator<String> NULLS_LAST = Comparator.nullsLast(Comparator.<String>naturalOrder());

    private static final Comparator<Map<String, Object>> STATEMENT_ORDER =
        Comparator.comparing((Map<String, Object> entry) -> RecordFields.string(entry, ENTRY_DATE), NULLS_LAST)
            .thenComparing(entry -> RecordFields.instant(entry, RecordFields.CREATED_AT),
                Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

    private final TransactionCoordinator coordinator;
    private final StoreMetrics metrics;
    private final Clock clock;

    /**
     * Recomputes and stores the entity's current balance.
     *
     * @return the new balance, or empty if the entity does not exist
     */
    public Optional<BigDecimal> recalculateBalance(LedgerType type, String entityId) {
        Objects.requireNonNull(type, "type");
        return coordinator.runTransaction(scopeOf(type), TxMode.READ_WRITE,
            scope -> recalculate(scope, type, entityId));
    }

    /**
     * Same as {@link #recalculateBalance(LedgerType, String)}, addressed by entity collection name.
     *
     * @throws IllegalArgumentException if the collection does not carry a ledger
     */
    public Optional<BigDecimal> recalculateBalance(String entityCollection, String entityId) {
        return recalculateBalance(LedgerType.fromEntityCollection(entityCollection), entityId);
    }

    /**
     * Records a ledger entry against an existing entity and recalculates its balance,
     * both in one transaction.
     *
     * @return the stored ledger entry
     * @throws RecordNotFoundException if the entity does not exist
     */
    public Map<String, Object> postEntry(LedgerType type, String entityId, LedgerPosting posting) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(posting, "posting");
        if (posting.getDebitOrZero().signum() < 0 || posting.getCreditOrZero().signum() < 0) {
            throw new IllegalArgumentException("Debit and credit must not be negative");
        }

        return coordinator.runTransaction(scopeOf(type), TxMode.READ_WRITE, scope -> {
            ScopedCollection entities = scope.collection(type.getEntityCollection());
            if (entities.getForUpdate(entityId).isEmpty()) {
                throw new RecordNotFoundException(type.getEntityCollection(), entityId);
            }

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(type.getOwnerField(), entityId);
            entry.put(ENTRY_DATE, Optional.ofNullable(posting.getEntryDate()).orElseGet(() -> LocalDate.now(clock)).toString());
            entry.put(PARTICULARS, posting.getParticulars());
            entry.put(DEBIT, posting.getDebitOrZero());
            entry.put(CREDIT, posting.getCreditOrZero());
            entry.put(REF_TYPE, posting.getRefType());
            entry.put(REF_ID, posting.getRefId());
            Map<String, Object> stored = scope.collection(type.getLedgerCollection()).add(entry);

            recalculate(scope, type, entityId);
            log.info("Ledger entry posted: type={}, entityId={}, debit={}, credit={}",
                type, entityId, posting.getDebitOrZero(), posting.getCreditOrZero());
            return stored;
        });
    }

    /**
     * Posts a signed amount: positive amounts are debits, negative amounts credits.
     */
    public Map<String, Object> postAmount(LedgerType type, String entityId, BigDecimal amount, String particulars) {
        Objects.requireNonNull(amount, "amount");
        LedgerPosting posting = LedgerPosting.builder()
            .debit(amount.signum() > 0 ? amount : BigDecimal.ZERO)
            .credit(amount.signum() < 0 ? amount.negate() : BigDecimal.ZERO)
            .particulars(particulars)
            .refType("flow")
            .build();
        return postEntry(type, entityId, posting);
    }

    /**
     * Returns the entity's entries ordered by entry date then creation time, each with the
     * balance after it, starting from the opening balance.
     *
     * @throws RecordNotFoundException if the entity does not exist
     */
    public List<StatementLine> getStatement(LedgerType type, String entityId) {
        Objects.requireNonNull(type, "type");
        return coordinator.runTransaction(scopeOf(type), TxMode.READ_ONLY, scope -> {
            Map<String, Object> entity = scope.collection(type.getEntityCollection()).get(entityId)
                .orElseThrow(() -> new RecordNotFoundException(type.getEntityCollection(), entityId));

            List<Map<String, Object>> entries = new ArrayList<>(
                scope.collection(type.getLedgerCollection()).getByIndex(type.getOwnerField(), entityId));
            entries.sort(STATEMENT_ORDER);

            BigDecimal balance = RecordFields.decimal(entity, OPENING_BALANCE);
            List<StatementLine> lines = new ArrayList<>(entries.size());
            for (Map<String, Object> entry : entries) {
                BigDecimal debit = RecordFields.decimal(entry, DEBIT);
                BigDecimal credit = RecordFields.decimal(entry, CREDIT);
                balance = balance.add(debit).subtract(credit);
                lines.add(new StatementLine(entry, debit, credit, balance));
            }
            return lines;
        });
    }

    private Optional<BigDecimal> recalculate(TransactionScope scope, LedgerType type, String entityId) {
        if (entityId == null) {
            return Optional.empty();
        }
        ScopedCollection entities = scope.collection(type.getEntityCollection());
        Optional<Map<String, Object>> entity = entities.getForUpdate(entityId);
        if (entity.isEmpty()) {
            log.debug("Balance recalculation skipped, entity gone: type={}, entityId={}", type, entityId);
            return Optional.empty();
        }

        List<Map<String, Object>> entries =
            scope.collection(type.getLedgerCollection()).getByIndex(type.getOwnerField(), entityId);
        BigDecimal movement = entries.stream()
            .map(entry -> RecordFields.decimal(entry, DEBIT).subtract(RecordFields.decimal(entry, CREDIT)))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal balance = RecordFields.decimal(entity.get(), OPENING_BALANCE).add(movement);

        entities.update(entityId, Map.of(CURRENT_BALANCE, balance));
        metrics.recordBalanceRecalculated(type.name());
        log.debug("Balance recalculated: type={}, entityId={}, entries={}, balance={}",
            type, entityId, entries.size(), balance);
        return Optional.of(balance);
    }

    private static List<String> scopeOf(LedgerType type) {
        return List.of(type.getEntityCollection(), type.getLedgerCollection());
    }
}
